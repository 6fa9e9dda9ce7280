package com.leakmonitor.backend.scan.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.leakmonitor.backend.scan.domain.NotificationLog;
import com.leakmonitor.backend.scan.domain.Scan;
import com.leakmonitor.backend.scan.domain.ScanStatus;
import com.leakmonitor.backend.scan.domain.ScanTrigger;
import com.leakmonitor.backend.scan.persistence.NotificationLogRepository;
import com.leakmonitor.backend.support.TestEntities;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

  @Mock private NotificationLogRepository notificationLogRepository;

  @Test
  void failingChannelDoesNotStopOthers() {
    RecordingNotifier broken = new RecordingNotifier("broken", true, true);
    RecordingNotifier disabled = new RecordingNotifier("disabled", false, false);
    RecordingNotifier log = new RecordingNotifier("log", true, false);
    NotificationDispatcher dispatcher =
        new NotificationDispatcher(List.of(broken, disabled, log), notificationLogRepository);

    dispatcher.dispatch(scan());

    assertThat(broken.calls).isEqualTo(1);
    assertThat(disabled.calls).isZero();
    assertThat(log.calls).isEqualTo(1);
    ArgumentCaptor<NotificationLog> rows = ArgumentCaptor.forClass(NotificationLog.class);
    verify(notificationLogRepository, times(2)).save(rows.capture());
    assertThat(rows.getAllValues())
        .extracting(NotificationLog::getChannel, NotificationLog::isSuccess)
        .containsExactly(
            tuple("broken", false),
            tuple("log", true));
    assertThat(rows.getAllValues().get(0).getMessage()).isEqualTo("channel down");
  }

  @Test
  void logFailureIsSwallowed() {
    when(notificationLogRepository.save(any())).thenThrow(new IllegalStateException("db down"));
    RecordingNotifier log = new RecordingNotifier("log", true, false);

    new NotificationDispatcher(List.of(log), notificationLogRepository).dispatch(scan());

    assertThat(log.calls).isEqualTo(1);
  }

  @Test
  void summaryDescribesTheRun() {
    Scan scan = scan();
    scan.setNewFindings(3);
    scan.setTotalFindings(9);
    scan.setReposScanned(4);
    scan.setReposFound(5);
    scan.setKeywordsUsed(2);

    assertThat(ScanSummaryFormatter.summary(scan))
        .isEqualTo(
            "Scan #7 completed: 3 new findings (9 open), 4 of 5 repositories scanned, 2 keywords, 90s");
  }

  private static Scan scan() {
    Scan scan = TestEntities.withId(new Scan(ScanTrigger.MANUAL), 7L);
    Instant started = Instant.parse("2024-05-10T10:00:00Z");
    scan.setStartedAt(started);
    scan.finish(ScanStatus.COMPLETED, started.plusSeconds(90));
    return scan;
  }

  private static final class RecordingNotifier implements ScanNotifier {

    private final String channel;
    private final boolean enabled;
    private final boolean fail;
    private int calls;

    RecordingNotifier(String channel, boolean enabled, boolean fail) {
      this.channel = channel;
      this.enabled = enabled;
      this.fail = fail;
    }

    @Override
    public String channel() {
      return channel;
    }

    @Override
    public boolean isEnabled() {
      return enabled;
    }

    @Override
    public void notify(Scan scan) {
      calls++;
      if (fail) {
        throw new IllegalStateException("channel down");
      }
    }
  }
}
