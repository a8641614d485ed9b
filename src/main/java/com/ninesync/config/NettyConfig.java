package com.ninesync.config;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.handler.ssl.OpenSsl;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;
import io.netty.handler.ssl.SupportedCipherSuiteFilter;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.net.ssl.SSLException;
import java.time.Clock;

/**
 * Netty client resources: event loop group and TLS context
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class NettyConfig {

    private final ClientProperties properties;

    @Bean(destroyMethod = "shutdownGracefully")
    public EventLoopGroup imapEventLoopGroup() {
        return new NioEventLoopGroup();
    }

    @Bean
    public SslContext clientSslContext() {
        try {
            // Use OpenSSL provider if available
            SslProvider provider = OpenSsl.isAvailable() ? SslProvider.OPENSSL : SslProvider.JDK;
            SslContextBuilder builder = SslContextBuilder.forClient()
                    .sslProvider(provider)
                    .protocols("TLSv1.2", "TLSv1.3")
                    .ciphers(null, SupportedCipherSuiteFilter.INSTANCE);
            if (properties.getTls().isTrustAll()) {
                log.warn("TLS certificate verification is DISABLED (ninesync.tls.trust-all=true)");
                builder.trustManager(InsecureTrustManagerFactory.INSTANCE);
            }
            SslContext ctx = builder.build();
            log.info("Client SSL/TLS context initialized (provider: {}, protocols: TLSv1.2+TLSv1.3)", provider);
            return ctx;
        } catch (SSLException e) {
            log.error("Failed to initialize SSL context: {}", e.getMessage());
            throw new IllegalStateException("SSL context initialization failed", e);
        }
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
