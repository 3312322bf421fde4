package im.arun.jsonnav.search;

import im.arun.jsonnav.JsonNavException;

public class SearchTimeoutException extends JsonNavException {

    public SearchTimeoutException(long timeoutMillis) {
        super("Search did not finish within " + timeoutMillis + " ms");
    }
}
