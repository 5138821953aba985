package br.com.analytics.pipeline.sales_insights_batch.config;

import br.com.analytics.pipeline.sales_insights_batch.model.AuthorMatchMode;
import br.com.analytics.pipeline.sales_insights_batch.model.CompositeMatchField;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceTag;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Settings of the sales insights batch, bound from {@code insights.*}.
 *
 * @param sources              layout per source; a source left out defaults to {@code DATAs/DATA<n>}
 * @param compositeMatchFields fields that, in order, corroborate a customer name match
 * @param authorMatchMode      how same-name author mentions are merged
 * @param eurToUsdRate         conversion rate applied to prices quoted in euros
 * @param runTimeout           upper bound for loading sources and for waiting on an in-flight run
 * @param store                where canonical entities and metrics are persisted
 */
@ConfigurationProperties(prefix = "insights")
public record InsightsProperties(
        Map<SourceTag, SourceLayout> sources,
        List<CompositeMatchField> compositeMatchFields,
        AuthorMatchMode authorMatchMode,
        BigDecimal eurToUsdRate,
        Duration runTimeout,
        StoreType store
) {

    public InsightsProperties {
        Map<SourceTag, SourceLayout> layouts = new EnumMap<>(SourceTag.class);
        for (SourceTag tag : SourceTag.values()) {
            SourceLayout configured = sources == null ? null : sources.get(tag);
            layouts.put(tag, configured != null
                    ? configured
                    : SourceLayout.standard("DATAs/DATA" + (tag.ordinal() + 1)));
        }
        sources = Collections.unmodifiableMap(layouts);
        compositeMatchFields = compositeMatchFields == null || compositeMatchFields.isEmpty()
                ? List.of(CompositeMatchField.ADDRESS, CompositeMatchField.PHONE)
                : List.copyOf(compositeMatchFields);
        authorMatchMode = authorMatchMode == null ? AuthorMatchMode.NAME_AND_CONTEXT : authorMatchMode;
        eurToUsdRate = eurToUsdRate == null ? new BigDecimal("1.2") : eurToUsdRate;
        runTimeout = runTimeout == null ? Duration.ofMinutes(10) : runTimeout;
        store = store == null ? StoreType.JDBC : store;
    }

    public static InsightsProperties defaults() {
        return new InsightsProperties(null, null, null, null, null, null);
    }
}
