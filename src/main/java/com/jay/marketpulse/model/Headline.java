package com.jay.marketpulse.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Headline {
    private String title;
    private String publisher;
    private String link;
    private String publishedAt;
}
