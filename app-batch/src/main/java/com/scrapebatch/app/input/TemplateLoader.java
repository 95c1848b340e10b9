package com.scrapebatch.app.input;

import com.scrapebatch.core.model.BatchConfig;
import com.scrapebatch.core.model.Template;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** &lt;dir&gt;/&lt;base&gt;&lt;n&gt;.txt (n = 1..count) 를 순서대로 읽는다. 하나라도 없으면 설정 오류 */
public final class TemplateLoader {
    private TemplateLoader() {}

    public static List<Template> load(BatchConfig.TemplateCfg cfg) throws IOException {
        Objects.requireNonNull(cfg, "cfg");
        List<Template> out = new ArrayList<>(cfg.getCount());
        for (int n = 1; n <= cfg.getCount(); n++) {
            String id = cfg.getBase() + n;
            Path p = cfg.getDir().resolve(id + ".txt");
            if (!Files.isRegularFile(p)) {
                throw new IOException("template not found: " + p.toAbsolutePath());
            }
            String text = Files.readString(p, StandardCharsets.UTF_8);
            if (text.isBlank()) {
                throw new IOException("template is empty: " + p.toAbsolutePath());
            }
            out.add(new Template(id, text));
        }
        return List.copyOf(out);
    }
}
