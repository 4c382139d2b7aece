package com.eainde.verifier.oracle.wolfram;

import com.eainde.verifier.oracle.OracleTransportException;
import com.eainde.verifier.oracle.OracleUnavailableException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;

/**
 * Posts {@code code=<program>} to a remote evaluation endpoint and returns the body.
 */
@Slf4j
public class RemoteWolframTransport implements WolframTransport {

    private final HttpUrl endpoint;
    private final OkHttpClient httpClient;

    public RemoteWolframTransport(String endpoint, Duration timeout) {
        this(endpoint, new OkHttpClient.Builder()
                .callTimeout(timeout)
                .readTimeout(timeout)
                .build());
    }

    /**
     * @throws OracleUnavailableException if {@code endpoint} is not an http(s) URL
     */
    RemoteWolframTransport(String endpoint, OkHttpClient httpClient) {
        HttpUrl url = endpoint == null ? null : HttpUrl.parse(endpoint.trim());
        if (url == null) {
            throw new OracleUnavailableException("Resolution endpoint '" + endpoint + "' is not an http(s) URL");
        }
        this.endpoint = url;
        this.httpClient = httpClient;
    }

    @Override
    public String execute(String code) throws OracleTransportException {
        Request request = new Request.Builder()
                .url(endpoint)
                .post(new FormBody.Builder().add("code", code).build())
                .build();

        log.debug("Posting {} chars of code to {}", code.length(), endpoint);
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new OracleTransportException("Resolution endpoint answered HTTP " + response.code() + ": " + text);
            }
            return text.trim();
        } catch (IOException e) {
            throw new OracleTransportException("Resolution endpoint " + endpoint + " unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "remote " + endpoint;
    }
}
