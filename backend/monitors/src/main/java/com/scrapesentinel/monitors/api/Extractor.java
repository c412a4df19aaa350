package com.scrapesentinel.monitors.api;

import com.scrapesentinel.core.error.ExtractionException;
import com.scrapesentinel.core.model.ExtractionResult;
import com.scrapesentinel.core.model.SelectorSpec;

public interface Extractor {
    ExtractionResult extract(String sourceKey, String content, SelectorSpec selectors) throws ExtractionException;
}
