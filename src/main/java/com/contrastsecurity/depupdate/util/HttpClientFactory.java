package com.contrastsecurity.depupdate.util;

import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.security.cert.X509Certificate;
import java.util.concurrent.TimeUnit;

/**
 * Utility class for creating OkHttpClient instances used against the registry.
 *
 * Certificate validation stays on unless the caller opts out with
 * {@code --insecure}, for registries behind SSL-intercepting proxies.
 */
public class HttpClientFactory {
    private static final Logger logger = LoggerFactory.getLogger(HttpClientFactory.class);

    private HttpClientFactory() {
        // Utility class - prevent instantiation
    }

    /**
     * Creates an OkHttpClient.Builder with default timeouts.
     *
     * @param trustAllCertificates Disable certificate validation
     * @return Configured OkHttpClient.Builder
     */
    public static OkHttpClient.Builder createHttpClientBuilder(boolean trustAllCertificates) {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .retryOnConnectionFailure(true);

        if (trustAllCertificates) {
            configureTrustAllSSL(builder);
        }
        return builder;
    }

    /**
     * Configures the OkHttpClient.Builder to trust all SSL certificates.
     *
     * @param builder The OkHttpClient.Builder to configure
     */
    private static void configureTrustAllSSL(OkHttpClient.Builder builder) {
        logger.warn("SSL certificate validation is disabled for registry requests");
        try {
            X509TrustManager trustAll = new X509TrustManager() {
                @Override
                public void checkClientTrusted(X509Certificate[] chain, String authType) {
                    // Trust all certificates
                }

                @Override
                public void checkServerTrusted(X509Certificate[] chain, String authType) {
                    // Trust all certificates
                }

                @Override
                public X509Certificate[] getAcceptedIssuers() {
                    return new X509Certificate[0];
                }
            };

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, new TrustManager[]{trustAll}, new java.security.SecureRandom());

            builder.sslSocketFactory(sslContext.getSocketFactory(), trustAll)
                   .hostnameVerifier((hostname, session) -> true);
        } catch (NoSuchAlgorithmException | KeyManagementException e) {
            logger.error("Error setting up SSL context: {}", e.getMessage());
            // Continue with default SSL settings
        }
    }
}
