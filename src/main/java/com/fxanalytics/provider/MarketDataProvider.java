package com.fxanalytics.provider;

import com.fxanalytics.domain.model.SecurityQuote;
import java.util.List;

/**
 * Source of raw reference quotes ({@code PX_LAST}, {@code PX_BID}, {@code PX_ASK}) keyed by
 * provider security id.
 *
 * <p>Implementations return one record per requested id where they can; an id the provider
 * does not recognize comes back as a {@code success=false} record rather than an exception.
 * Exceptions are reserved for failures of the whole call (transport, timeout, malformed
 * response) and are classified by {@link com.fxanalytics.resilience.ProviderErrors}.
 */
public interface MarketDataProvider {

    List<SecurityQuote> fetchQuotes(List<String> securityIds);
}
