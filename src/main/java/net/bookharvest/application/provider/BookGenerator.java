package net.bookharvest.application.provider;

import net.bookharvest.domain.backfill.CandidateBook;
import net.bookharvest.domain.provider.ServiceContext;

import java.util.List;

/**
 * Provider capable of {@code BOOK_GENERATION}.
 */
public interface BookGenerator extends BookProvider {

    /**
     * @throws net.bookharvest.domain.provider.ProviderException when generation fails
     */
    List<CandidateBook> generate(BookGenerationRequest request, ServiceContext context);
}
