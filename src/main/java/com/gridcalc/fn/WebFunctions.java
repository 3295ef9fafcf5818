package com.gridcalc.fn;

import com.gridcalc.api.EvaluationError;
import com.gridcalc.api.EvaluationException;
import com.gridcalc.api.Value;

import java.io.IOException;

/** GET: blocking fetch of a URL, returning the body as text. */
final class WebFunctions {

    private WebFunctions() {
    }

    static void register(FunctionRegistry.Builder b, HttpFetcher fetcher) {
        b.exactly("GET", 1, args -> {
            String url = args.text(0);
            if (url.isBlank())
                throw new EvaluationException(EvaluationError.NETWORK, "GET: empty URL");
            try {
                return Value.text(fetcher.get(url));
            } catch (IOException e) {
                throw new EvaluationException(EvaluationError.NETWORK, "GET " + url + " failed: " + e.getMessage(), e);
            }
        });
    }
}
