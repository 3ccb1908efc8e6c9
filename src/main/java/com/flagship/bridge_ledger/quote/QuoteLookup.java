package com.flagship.bridge_ledger.quote;

import com.flagship.bridge_ledger.conversion.Quote;
import lombok.Value;

/**
 * A quote plus whether it came from the last-known fallback.
 */
@Value
public class QuoteLookup {
    Quote quote;
    boolean degraded;

    public static QuoteLookup live(Quote quote) {
        return new QuoteLookup(quote, false);
    }

    public static QuoteLookup fallback(Quote quote) {
        return new QuoteLookup(quote, true);
    }
}
