/*
 * どこで: Kafka 初期化共通処理
 * 何を: 存在しないトピックだけを作成する (check-then-create)
 * なぜ: publish/subscribe 前にパーティション数と保持期間を確定させるため
 */
package com.example.fanout.common.kafka;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.errors.TopicExistsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Admin は Spring 管理の共有クライアントで防御的コピーが不可能なため")
public class TopicProvisioner {

  private static final Logger logger = LoggerFactory.getLogger(TopicProvisioner.class);

  private final Admin admin;
  private final Duration timeout;

  public TopicProvisioner(Admin admin, Duration timeout) {
    this.admin = admin;
    this.timeout = timeout;
  }

  /**
   * 未作成のトピックを作成する。
   *
   * @return 今回作成したトピック名
   * @throws TopicProvisioningException 一覧取得/作成に失敗した場合
   */
  public Set<String> ensureTopics(Collection<TopicSpec> specs) {
    try {
      Set<String> existing = admin.listTopics().names().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      List<NewTopic> missing =
          specs.stream()
              .filter(spec -> !existing.contains(spec.name()))
              .map(TopicSpec::toNewTopic)
              .toList();
      if (missing.isEmpty()) {
        return Set.of();
      }
      try {
        admin.createTopics(missing).all().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (ExecutionException ex) {
        // 別インスタンスが同時に作成した場合は確保済みとみなす
        if (!(ex.getCause() instanceof TopicExistsException)) {
          throw ex;
        }
        logger.info("topic already created concurrently cause={}", ex.getCause().getMessage());
      }
      Set<String> created = missing.stream().map(NewTopic::name).collect(Collectors.toSet());
      logger.info("kafka topics created topics={}", created);
      return created;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new TopicProvisioningException("interrupted while ensuring topics", ex);
    } catch (ExecutionException | TimeoutException ex) {
      throw new TopicProvisioningException("failed to ensure topics", ex);
    }
  }

  public void ensureTopic(TopicSpec spec) {
    ensureTopics(List.of(spec));
  }
}
