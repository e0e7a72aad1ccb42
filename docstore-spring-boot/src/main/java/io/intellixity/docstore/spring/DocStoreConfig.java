package io.intellixity.docstore.spring;

import io.intellixity.docstore.DocumentStore;
import io.intellixity.docstore.selection.StoreSettings;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(DocStoreProperties.class)
public class DocStoreConfig {

  @Bean
  public StoreSettings storeSettings(DocStoreProperties props) {
    return props.toSettings(props.isUseEnvironment() ? StoreSettings.fromEnvironment() : StoreSettings.none());
  }

  // Engine selection stays lazy: nothing connects until the first store call.
  @Bean(destroyMethod = "close")
  public DocumentStore documentStore(StoreSettings storeSettings) {
    return new DocumentStore(storeSettings);
  }
}
