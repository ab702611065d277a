package com.ospicorp.capacityforecast.config;

import static org.springframework.security.config.Customizer.withDefaults;

import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.header.writers.CrossOriginOpenerPolicyHeaderWriter;
import org.springframework.security.web.header.writers.CrossOriginResourcePolicyHeaderWriter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter;
import org.springframework.security.web.header.writers.StaticHeadersWriter;

// No authentication: the chain only hardens response headers.
@Configuration
public class SecurityConfig {

  @Bean
  SecurityFilterChain openChain(HttpSecurity http) throws Exception {
    http.csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
        .headers(headers -> {
          headers.defaultsDisabled();
          headers.frameOptions(frame -> frame.deny());
          headers.contentTypeOptions(withDefaults());
          headers.referrerPolicy(referrer -> referrer.policy(
              ReferrerPolicyHeaderWriter.ReferrerPolicy.NO_REFERRER));
          headers.crossOriginOpenerPolicy(coop -> coop.policy(
              CrossOriginOpenerPolicyHeaderWriter.CrossOriginOpenerPolicy.SAME_ORIGIN));
          headers.crossOriginResourcePolicy(corp -> corp.policy(
              CrossOriginResourcePolicyHeaderWriter.CrossOriginResourcePolicy.SAME_ORIGIN));
          headers.addHeaderWriter(new StaticHeadersWriter("Cache-Control", "no-store"));
        });
    return http.build();
  }

  @Bean
  WebServerFactoryCustomizer<TomcatServletWebServerFactory> tomcatCustomizer() {
    return factory -> factory.addConnectorCustomizers(connector -> connector.setXpoweredBy(false));
  }
}
