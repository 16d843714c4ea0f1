package io.veomenu.backend.auth;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.veomenu.backend.config.CleanupProperties;
import io.veomenu.backend.session.UserSessionRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class CredentialCleanupServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
  private static final Instant CUTOFF = NOW.minus(Duration.ofHours(24));

  @Mock private MagicLinkRepository linkRepository;
  @Mock private OtpChallengeRepository challengeRepository;
  @Mock private PhoneVerificationRepository phoneVerificationRepository;
  @Mock private UserSessionRepository sessionRepository;
  @Mock private TransactionTemplate transactionTemplate;

  @BeforeEach
  void runCallbacksInline() {
    lenient()
        .when(transactionTemplate.execute(any()))
        .thenAnswer(inv -> inv.<TransactionCallback<?>>getArgument(0).doInTransaction(null));
  }

  private CredentialCleanupService service(boolean enabled) {
    return new CredentialCleanupService(
        linkRepository,
        challengeRepository,
        phoneVerificationRepository,
        sessionRepository,
        transactionTemplate,
        new CleanupProperties(Duration.ofHours(24), enabled),
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void purgesEveryCredentialStorePastRetention() {
    when(linkRepository.deleteExpiredBefore(CUTOFF)).thenReturn(2);
    when(challengeRepository.deleteExpiredBefore(CUTOFF)).thenReturn(1);
    when(phoneVerificationRepository.deleteExpiredBefore(CUTOFF)).thenReturn(5);
    when(sessionRepository.deleteExpiredBefore(CUTOFF)).thenReturn(0);

    service(true).cleanupExpiredCredentials();

    verify(linkRepository).deleteExpiredBefore(CUTOFF);
    verify(challengeRepository).deleteExpiredBefore(CUTOFF);
    verify(phoneVerificationRepository).deleteExpiredBefore(CUTOFF);
    verify(sessionRepository).deleteExpiredBefore(CUTOFF);
  }

  @Test
  void oneFailingStoreDoesNotStopTheOthers() {
    when(linkRepository.deleteExpiredBefore(CUTOFF))
        .thenThrow(new QueryTimeoutException("lock wait"));
    when(challengeRepository.deleteExpiredBefore(CUTOFF)).thenReturn(3);
    when(sessionRepository.deleteExpiredBefore(CUTOFF)).thenReturn(4);

    service(true).cleanupExpiredCredentials();

    verify(challengeRepository).deleteExpiredBefore(CUTOFF);
    verify(phoneVerificationRepository).deleteExpiredBefore(CUTOFF);
    verify(sessionRepository).deleteExpiredBefore(CUTOFF);
  }

  @Test
  void disabledCleanupTouchesNothing() {
    service(false).cleanupExpiredCredentials();

    verifyNoInteractions(
        linkRepository, challengeRepository, phoneVerificationRepository, sessionRepository);
  }
}
