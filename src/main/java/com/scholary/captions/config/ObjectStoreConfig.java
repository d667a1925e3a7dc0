package com.scholary.captions.config;

import com.scholary.captions.objectstore.ObjectStoreClient;
import com.scholary.captions.objectstore.ObjectStoreProperties;
import com.scholary.captions.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Wires up the ObjectStoreClient bean using properties from application.yml. The client is
 * closed with the application context.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
