package com.jay.marketpulse.layer1_data;

import com.jay.marketpulse.model.Headline;

import java.util.List;

public interface NewsSource {

    /** Most recent headlines for a free-text query, newest first, at most {@code limit}. */
    List<Headline> headlines(String query, int limit);
}
