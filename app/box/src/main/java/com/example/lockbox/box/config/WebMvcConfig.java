/*
 * どこで: Box Web 設定
 * 何を: RequestMdcInterceptor を Box API と内部 API のリクエストへ適用する
 * なぜ: API ログへ運用キーを安定して埋め込むため
 */
package com.example.lockbox.box.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    // actuator は対象外
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns("/v1/**", "/internal/**");
  }
}
