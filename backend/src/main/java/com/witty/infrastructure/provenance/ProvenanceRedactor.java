package com.witty.infrastructure.provenance;

import com.witty.domain.formalize.model.EnrichmentSource;
import com.witty.domain.formalize.model.OriginSpan;
import com.witty.domain.formalize.model.PrivacyMode;
import com.witty.domain.formalize.model.ProvenanceEvent;
import com.witty.domain.formalize.model.ProvenanceRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Privacy redaction of provenance records.
 *
 * - DEFAULT → record passes through unchanged.
 * - STRICT → raw excerpts and URLs in the event log and enrichment sources are replaced with
 *   [REDACTED:...] markers that reference the origin span or source id. Ids, kinds, timestamps,
 *   spans and confidences are preserved.
 *
 * Markers are never rewritten again, so redacting twice equals redacting once.
 */
@Component
public class ProvenanceRedactor {

    static final String MARKER_PREFIX = "[REDACTED:";

    // URL without trailing punctuation (.,:;)
    private static final Pattern URL = Pattern.compile(
            "(?:https?://|www\\.)[\\w\\-.~:/?#\\[\\]@!$&'()*+,;=%]+[\\w/=]");

    public ProvenanceRecord redact(ProvenanceRecord record, PrivacyMode mode) {
        if (record == null || mode != PrivacyMode.STRICT) {
            return record;
        }

        List<ProvenanceEvent> events = record.eventLog().stream().map(this::redactEvent).toList();
        List<EnrichmentSource> sources = record.enrichmentSources().stream().map(this::redactSource).toList();

        return record.toBuilder()
                .eventLog(events)
                .enrichmentSources(sources)
                .reductionRationale(scrubUrls(record.reductionRationale()))
                .build();
    }

    private ProvenanceEvent redactEvent(ProvenanceEvent event) {
        String excerpt = event.excerpt();
        if (excerpt != null && !isMarker(excerpt)) {
            excerpt = event.excerptSpan() != null
                    ? MARKER_PREFIX + "span=" + event.excerptSpan() + "]"
                    : MARKER_PREFIX + "excerpt]";
        }
        return event.withExcerpt(excerpt, event.excerptSpan()).withDetail(scrubUrls(event.detail()));
    }

    private EnrichmentSource redactSource(EnrichmentSource source) {
        String marker = sourceMarker(source.sourceId(), source.span());
        String url = source.url() == null || isMarker(source.url()) ? source.url() : marker;
        String excerpt = source.excerpt() == null || isMarker(source.excerpt()) ? source.excerpt() : marker;
        return new EnrichmentSource(source.sourceId(), url, excerpt, source.span());
    }

    private static String sourceMarker(String sourceId, OriginSpan span) {
        return MARKER_PREFIX + "source=" + sourceId + (span != null ? ",span=" + span : "") + "]";
    }

    private static String scrubUrls(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return URL.matcher(text).replaceAll(MARKER_PREFIX + "url]");
    }

    private static boolean isMarker(String value) {
        return value.startsWith(MARKER_PREFIX);
    }
}
