/*
 * どこで: Safety Web 設定
 * 何を: RequestMdcInterceptor を全リクエストへ適用する
 * なぜ: 解析/リマインダー API のログへ request_id を安定して埋め込むため
 */
package com.medsafe.safety.config;

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
    // 業務 API のみ対象
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns("/v1/**");
  }
}
