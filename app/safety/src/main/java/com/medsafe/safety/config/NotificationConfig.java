/*
 * どこで: Safety アプリの設定
 * 何を: 通知送信専用のスレッドプールを Bean として提供する
 * なぜ: 送信処理をタイムアウト付きで待てるよう、呼び出し元スレッドから切り離すため
 */
package com.medsafe.safety.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NotificationConfig {

  static final int TRANSPORT_THREADS = 2;

  @Bean(name = "transportExecutor", destroyMethod = "shutdownNow")
  public ExecutorService transportExecutor() {
    return Executors.newFixedThreadPool(
        TRANSPORT_THREADS,
        new ThreadFactoryBuilder().setNameFormat("notification-transport-%d").setDaemon(true).build());
  }
}
