package com.scrapebatch.app.input;

import com.scrapebatch.core.cache.KeyComposer;
import com.scrapebatch.core.model.WorkUnit;
import com.scrapebatch.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * projects.yml → WorkUnit 목록.
 *
 * projects:
 *   - name: "Alpha"
 *     urls:
 *       - "https://alpha.example/about"
 *       - "see https://alpha.example/team (updated)"   # 자유 텍스트면 첫 http(s) 토큰
 *   - name: "Beta"
 *     url: "https://beta.example"                       # 단일 url 도 허용
 *
 * 루트가 곧바로 리스트여도 된다. 같은 이름(공백 정규화 기준)은 하나로 합치고,
 * URL이 하나도 없는 항목은 경고 후 건너뛴다.
 */
public final class WorkUnitLoader {
    private static final Logger LOG = LoggerFactory.getLogger(WorkUnitLoader.class);

    private WorkUnitLoader() {}

    public static List<WorkUnit> load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) {
            throw new IOException("input not found at: " + file.toAbsolutePath());
        }
        Object root;
        try (InputStream in = Files.newInputStream(file)) {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
        } catch (RuntimeException e) {
            throw new IOException("invalid input " + file.getFileName() + ": " + e.getMessage(), e);
        }

        List<?> rows;
        if (root == null) {
            rows = List.of();
        } else if (root instanceof List<?> l) {
            rows = l;
        } else if (root instanceof Map<?, ?> m && m.get("projects") instanceof List<?> l) {
            rows = l;
        } else {
            throw new IOException("input must be a list of projects or contain a 'projects' list: " + file);
        }
        return toUnits(rows);
    }

    static List<WorkUnit> toUnits(List<?> rows) {
        Map<String, Set<String>> urlsByName = new LinkedHashMap<>();
        int rowNo = 0;

        for (Object row : rows) {
            rowNo++;
            if (!(row instanceof Map<?, ?> m)) {
                LOG.warn("Skipping row #{}: not a mapping", rowNo);
                continue;
            }
            Object rawName = m.get("name");
            if (rawName == null || String.valueOf(rawName).isBlank()) {
                LOG.warn("Skipping row #{}: missing project name", rowNo);
                continue;
            }
            String name = KeyComposer.normalizeNamespace(String.valueOf(rawName));

            List<String> found = new ArrayList<>();
            collectUrls(m.get("url"), found);
            collectUrls(m.get("urls"), found);
            if (found.isEmpty()) {
                LOG.warn("Skipping row #{} ({}): no http(s) URL", rowNo, name);
                continue;
            }
            urlsByName.computeIfAbsent(name, k -> new LinkedHashSet<>()).addAll(found);
        }

        List<WorkUnit> units = new ArrayList<>(urlsByName.size());
        for (Map.Entry<String, Set<String>> e : urlsByName.entrySet()) {
            units.add(new WorkUnit(e.getKey(), new ArrayList<>(e.getValue())));
        }
        LOG.info("Loaded {} work unit(s), {} url(s)", units.size(),
                units.stream().mapToInt(u -> u.urls().size()).sum());
        return units;
    }

    private static void collectUrls(Object v, List<String> out) {
        if (v == null) return;
        if (v instanceof List<?> list) {
            for (Object o : list) collectUrls(o, out);
            return;
        }
        String url = UrlUtils.firstUrlIn(String.valueOf(v));
        if (url != null) out.add(url);
    }
}
