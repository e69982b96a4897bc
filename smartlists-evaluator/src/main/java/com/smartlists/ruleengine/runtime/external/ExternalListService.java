package com.smartlists.ruleengine.runtime.external;

import com.smartlists.ruleengine.api.ExternalListProvider;
import com.smartlists.ruleengine.api.exceptions.RunCancelledException;
import com.smartlists.ruleengine.api.model.ExternalListResult;
import com.smartlists.ruleengine.cache.EvaluationCache;
import com.smartlists.ruleengine.runtime.evaluation.ItemEvaluationException;
import com.smartlists.ruleengine.runtime.model.CompiledExpression;
import com.smartlists.ruleengine.runtime.model.RuleGroups;
import com.smartlists.ruleengine.runtime.model.TargetValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fetches the external lists a rule set refers to, once per URL and run.
 *
 * <p>Fetch problems never abort a run: a URL no provider handles, an I/O error or a
 * provider bug yields an empty list and a warning. Interruption is the exception and
 * surfaces as a {@link RunCancelledException}.
 */
public final class ExternalListService {
    private static final Logger logger = LoggerFactory.getLogger(ExternalListService.class);

    private final List<ExternalListProvider> providers;

    public ExternalListService(List<ExternalListProvider> providers) {
        this.providers = List.copyOf(Objects.requireNonNull(providers, "providers must not be null"));
    }

    /**
     * Distinct list URLs referenced by ExternalList rules, in rule order.
     */
    public static Set<String> referencedUrls(RuleGroups ruleGroups) {
        Set<String> urls = new LinkedHashSet<>();
        for (CompiledExpression expression : ruleGroups.allExpressions()) {
            if (expression.target() instanceof TargetValue.ExternalList) {
                urls.add(((TargetValue.ExternalList) expression.target()).url());
            }
        }
        return urls;
    }

    /**
     * Fetches every URL through the run cache and indexes the results.
     *
     * @throws RunCancelledException if a fetch was interrupted
     */
    public ExternalListIndex prefetch(Set<String> urls, EvaluationCache cache) {
        Map<String, ExternalListResult> lists = new LinkedHashMap<>();
        for (String url : urls) {
            try {
                lists.put(url, cache.externalList(url, () -> fetch(url)));
            } catch (ItemEvaluationException e) {
                if (e.getCause() instanceof RunCancelledException) {
                    throw (RunCancelledException) e.getCause();
                }
                throw e;
            }
        }
        return new ExternalListIndex(lists, cache);
    }

    private ExternalListResult fetch(String url) {
        try {
            ExternalListProvider provider = providerFor(url);
            if (provider == null) {
                logger.warn("No external list provider handles {}, treating the list as empty", url);
                return ExternalListResult.empty(url);
            }
            ExternalListResult result = provider.fetch(url);
            if (result == null) {
                return ExternalListResult.empty(url);
            }
            logger.debug("Fetched external list {} with {} entries", url, result.entries().size());
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("Interrupted while fetching external list " + url, e);
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to fetch external list {}, treating it as empty: {}", url, e.getMessage());
            return ExternalListResult.empty(url);
        }
    }

    private ExternalListProvider providerFor(String url) {
        for (ExternalListProvider provider : providers) {
            if (provider.canHandle(url)) {
                return provider;
            }
        }
        return null;
    }
}
