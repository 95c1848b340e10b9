package com.scrapebatch.core.checkpoint;

import com.scrapebatch.core.model.UnitResult;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** checkpoint.json 직렬화 형태 */
public final class CheckpointDocument {
    public static final int CURRENT_VERSION = 1;

    public int version = CURRENT_VERSION;
    public Instant savedAt;
    public Map<String, UnitResult> units = new LinkedHashMap<>();
}
