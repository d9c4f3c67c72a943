package com.ospicorp.stockfeed.config;

import com.ospicorp.stockfeed.history.web.CsvHttpMessageConverter;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  @Override
  public void extendMessageConverters(@NonNull List<HttpMessageConverter<?>> converters) {
    // appended: JSON stays the default when the client does not ask for CSV
    converters.add(new CsvHttpMessageConverter());
  }
}
