package org.moviegraph.configuration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(BuildProperties.class)
public class BuildConfiguration {
}
