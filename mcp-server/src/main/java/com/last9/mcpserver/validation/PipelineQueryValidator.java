package com.last9.mcpserver.validation;

import com.last9.mcpserver.catalog.AttributeCatalog;
import com.last9.mcpserver.query.model.Pipeline;
import com.last9.shared.telemetry.exception.ValidationException;
import com.last9.shared.telemetry.model.TelemetrySignal;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.TreeSet;

/**
 * Rejects pipelines that reference fields the tenant does not have.
 *
 * A field is accepted when it is a standard field of the signal, a name derived by a parse
 * stage anywhere in the pipeline, or matched in the catalog by {@link AttributeFieldMatcher}.
 * With an empty catalog only the structural checks done at parse time apply.
 */
@Component
@Log4j2
public class PipelineQueryValidator {

    /**
     * @throws ValidationException listing the sorted, de-duplicated unsupported fields
     */
    public void validate(TelemetrySignal signal, Pipeline pipeline, AttributeCatalog catalog) {
        if (catalog.isEmpty()) {
            log.debug("Attribute catalog empty, skipping field existence checks for {} query", signal.getLabel());
            return;
        }

        FieldReferenceCollector refs = FieldReferenceCollector.collect(pipeline);
        Set<String> derived = refs.derived();
        Set<String> invalid = new TreeSet<>();
        for (String field : refs.referenced()) {
            if (field.isEmpty() || signal.getStandardFields().contains(field) || derived.contains(field)) {
                continue;
            }
            if (!AttributeFieldMatcher.isAllowed(field, catalog)) {
                invalid.add(field);
            }
        }

        if (!invalid.isEmpty()) {
            String message = String.format("%s query uses unsupported fields: %s",
                    signal.getLabel(), String.join(", ", invalid));
            log.info("Rejected pipeline: {}", message);
            throw new ValidationException(message);
        }
    }
}
