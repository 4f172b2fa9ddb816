package ou.capstone.fantasy.api;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.fantasy.exceptions.ProviderException;
import ou.capstone.fantasy.exceptions.RateLimitException;

/**
 * Fetches raw HTML pages from the PDGA website.
 * <p>
 * To log request and response details use -DPdgaWebClient.VerboseLogging=true
 */
public class PdgaWebClient
{
    private static final Logger logger = LoggerFactory.getLogger(PdgaWebClient.class);

    public static final String DEFAULT_BASE_URL = "https://www.pdga.com";

    private static final int DEFAULT_TIMEOUT_SECONDS = 15;

    private static final String USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
                    + "Chrome/120.0.0.0 Safari/537.36";

    private static final boolean VERBOSE_LOGGING_ENABLED = System.getProperty(
                    "PdgaWebClient.VerboseLogging", "false" )
            .equalsIgnoreCase( "true" );

    private final HttpClient http;
    private final String baseUrl;
    private final Duration timeout;

    public PdgaWebClient()
    {
        this( DEFAULT_BASE_URL, DEFAULT_TIMEOUT_SECONDS );
    }

    public PdgaWebClient( final String baseUrl, final int timeoutSeconds )
    {
        this.baseUrl = stripTrailingSlash( baseUrl );
        this.timeout = Duration.ofSeconds( timeoutSeconds > 0 ? timeoutSeconds : DEFAULT_TIMEOUT_SECONDS );
        this.http = HttpClient.newBuilder()
                .connectTimeout( this.timeout )
                .followRedirects( HttpClient.Redirect.NORMAL )
                .build();
    }

    /**
     * Fetches a page.
     *
     * @param path  absolute path on the site, e.g. "/tour/event/88276"
     * @param query query parameters, may be empty
     * @return the body, or empty if the site answered 404
     * @throws RateLimitException on HTTP 429
     * @throws ProviderException  on any other failure
     */
    public Optional<String> fetchPage( final String path, final Map<String, String> query )
            throws ProviderException
    {
        final URI uri = buildUri( path, query );

        if (VERBOSE_LOGGING_ENABLED) {
            logger.debug("=== PDGA Request Details ===");
            logger.debug("Full URL: {}", uri);
            logger.debug("Timeout: {} seconds", timeout.getSeconds());
            logger.debug("============================");
        } else {
            logger.debug("Requesting URL: {}", uri);
        }

        final HttpRequest request = HttpRequest.newBuilder( uri )
                .GET()
                .header( "User-Agent", USER_AGENT )
                .header( "Accept", "text/html" )
                .timeout( timeout )
                .build();

        final HttpResponse<String> response;
        try {
            response = http.send( request, BodyHandlers.ofString( StandardCharsets.UTF_8 ) );
        }
        catch( final IOException e ) {
            logger.error( "Could not make HTTP request to {}", uri, e );
            throw new ProviderException( "Request to " + uri + " failed", e );
        }
        catch( final InterruptedException e ) {
            Thread.currentThread().interrupt();
            logger.error( "Interrupted while requesting {}", uri );
            throw new ProviderException( "Interrupted while requesting " + uri, e );
        }

        final int status = response.statusCode();
        logger.debug( "PDGA response status: {} for {}", status, uri );

        if (status == 200) {
            final String body = response.body();
            if (VERBOSE_LOGGING_ENABLED && !body.isEmpty()) {
                final String preview = body.length() > 500 ? body.substring(0, 500) + "..." : body;
                logger.debug("Response Body Preview:\n{}", preview);
            }
            return Optional.of( body );
        } else if (status == 404) {
            logger.info( "PDGA page not found: {}", uri );
            return Optional.empty();
        } else if (status == 429) {
            logger.warn( "PDGA rate limit exceeded. URL: {}", uri );
            throw new RateLimitException( "PDGA rate limit has been exceeded. Please wait a few minutes and try again." );
        } else {
            logger.error( "PDGA returned non-200 status: {}. URL: {}", status, uri );
            throw new ProviderException( "PDGA returned non-200 status: " + status );
        }
    }

    URI buildUri( final String path, final Map<String, String> query )
    {
        final String queryString = (query == null ? Map.<String, String>of() : new LinkedHashMap<>( query ))
                .entrySet().stream()
                .map( e -> URLEncoder.encode( e.getKey(), StandardCharsets.UTF_8 ) + "="
                        + URLEncoder.encode( e.getValue(), StandardCharsets.UTF_8 ) )
                .collect( Collectors.joining( "&" ) );
        final String normalizedPath = path.startsWith( "/" ) ? path : "/" + path;
        return URI.create( baseUrl + normalizedPath + (queryString.isEmpty() ? "" : "?" + queryString) );
    }

    private static String stripTrailingSlash( final String url )
    {
        if (url == null || url.isBlank()) {
            return DEFAULT_BASE_URL;
        }
        return url.endsWith( "/" ) ? url.substring( 0, url.length() - 1 ) : url;
    }
}
