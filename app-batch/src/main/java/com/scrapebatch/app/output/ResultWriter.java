package com.scrapebatch.app.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scrapebatch.core.model.BatchResult;
import com.scrapebatch.core.model.RunReport;
import com.scrapebatch.core.model.UnitResult;
import com.scrapebatch.core.store.FileAtomicStore;
import com.scrapebatch.core.util.Json;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Objects;

/** 집계 결과 파일: &lt;outputDir&gt;/results-yyyyMMdd-HHmm.json (원자적 교체) */
public final class ResultWriter {
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmm");

    private final ObjectMapper om = Json.mapper();
    private final FileAtomicStore store;

    public ResultWriter(Path outputDir) {
        this.store = new FileAtomicStore(Objects.requireNonNull(outputDir, "outputDir"));
    }

    /** 직렬화 형태 */
    public static final class ResultDocument {
        public RunReport report;
        public Map<String, UnitResult> units;
    }

    public static String fileName(LocalDateTime at) {
        return "results-" + STAMP.format(at) + ".json";
    }

    public Path write(BatchResult result) throws IOException {
        return write(result, LocalDateTime.now());
    }

    public Path write(BatchResult result, LocalDateTime at) throws IOException {
        Objects.requireNonNull(result, "result");
        ResultDocument doc = new ResultDocument();
        doc.report = result.report();
        doc.units = result.units();
        String json;
        try {
            json = om.writerWithDefaultPrettyPrinter().writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new IOException("result serialization failed", e);
        }
        String name = fileName(at);
        store.write(name, json);
        return store.pathOf(name);
    }
}
