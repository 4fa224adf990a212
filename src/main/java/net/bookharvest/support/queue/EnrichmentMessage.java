package net.bookharvest.support.queue;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request for downstream metadata enrichment of a batch of ISBNs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EnrichmentMessage(@JsonProperty("isbns") List<String> isbns,
                                @JsonProperty("source") String source,
                                @JsonProperty("priority") String priority,
                                @JsonProperty("job_id") String jobId) {

    public EnrichmentMessage {
        isbns = isbns == null ? List.of() : List.copyOf(isbns);
    }
}
