package com.phillippitts.uptimemonitor.service.probe.http;

/**
 * Final response of an HTTP check, after redirects.
 *
 * @param statusCode   HTTP status code
 * @param reasonPhrase reason phrase, may be empty
 * @param body         decoded body, empty when the response had none
 */
public record HttpProbeResponse(int statusCode, String reasonPhrase, String body) {
    public HttpProbeResponse {
        reasonPhrase = reasonPhrase == null ? "" : reasonPhrase;
        body = body == null ? "" : body;
    }
}
