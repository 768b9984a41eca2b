package com.eups.dependencyview.fetch;

import com.eups.dependencyview.exception.DocumentFetchException;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Fetches documents over HTTP(S) with OkHttp. One blocking request at a time.
 */
public class HttpDocumentFetcher implements DocumentFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpDocumentFetcher.class);

    private final OkHttpClient client;
    private final FetcherSettings settings;

    public HttpDocumentFetcher(FetcherSettings settings) {
        this.settings = settings;
        this.client = new OkHttpClient.Builder()
                .connectTimeout(settings.getConnectTimeout())
                .readTimeout(settings.getReadTimeout())
                .followRedirects(true)
                .build();
    }

    @Override
    public List<String> fetch(String url) {
        HttpUrl httpUrl = HttpUrl.parse(url);
        if (httpUrl == null) {
            throw new DocumentFetchException(url, "not an http(s) URL");
        }

        Request request = new Request.Builder()
                .url(httpUrl)
                .header("User-Agent", settings.getUserAgent())
                .get()
                .build();

        log.debug("GET {}", url);
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new DocumentFetchException(url, "HTTP " + response.code() + " " + response.message());
            }
            ResponseBody body = response.body();
            String content = body != null ? body.string() : "";
            return content.lines().collect(Collectors.toList());
        } catch (IOException e) {
            throw new DocumentFetchException(url, e);
        }
    }
}
