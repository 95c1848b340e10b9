package com.scrapebatch.app.process;

import com.scrapebatch.core.api.ItemProcessor;
import com.scrapebatch.core.api.ItemProcessorProvider;
import com.scrapebatch.core.model.BatchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * ServiceLoader로 ItemProcessorProvider를 찾는다.
 * 없으면(또는 dryRun이면) DryRunProcessor. 여러 개면 id 사전순 첫 번째.
 */
public final class ProcessorResolver {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessorResolver.class);

    private ProcessorResolver() {}

    public static ItemProcessor resolve(BatchConfig config, boolean dryRun) {
        if (dryRun) {
            LOG.info("Dry-run requested: using DryRunProcessor");
            return new DryRunProcessor();
        }
        List<ItemProcessorProvider> found = new ArrayList<>();
        ServiceLoader.load(ItemProcessorProvider.class).forEach(found::add);
        if (found.isEmpty()) {
            LOG.warn("No ItemProcessorProvider registered: falling back to DryRunProcessor");
            return new DryRunProcessor();
        }
        found.sort((a, b) -> a.id().compareTo(b.id()));
        ItemProcessorProvider chosen = found.get(0);
        if (found.size() > 1) {
            LOG.warn("{} ItemProcessorProviders found, using '{}'", found.size(), chosen.id());
        } else {
            LOG.info("Using ItemProcessorProvider '{}'", chosen.id());
        }
        return chosen.create(config);
    }
}
