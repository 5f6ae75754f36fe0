package io.terraform.tfe.run;

import io.terraform.tfe.TfeException;

import java.net.URI;
import java.net.URISyntaxException;

final class LogUrls {

    private LogUrls() {
    }

    static URI parse(String kind, String id, String logReadUrl) throws TfeException {
        if (logReadUrl == null || logReadUrl.isBlank()) {
            throw new TfeException(kind + " " + id + " does not have a log URL");
        }
        try {
            URI uri = new URI(logReadUrl);
            if (!uri.isAbsolute()) {
                throw new TfeException("invalid log URL: " + logReadUrl);
            }
            return uri;
        } catch (URISyntaxException ex) {
            throw new TfeException("invalid log URL: " + ex.getMessage(), ex);
        }
    }
}
