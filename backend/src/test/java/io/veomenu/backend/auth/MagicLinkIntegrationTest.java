package io.veomenu.backend.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.veomenu.backend.testutil.AuthTestSupport;
import io.veomenu.backend.testutil.AuthTestSupport.RegisteredUser;
import io.veomenu.backend.testutil.MutableClock;
import io.veomenu.backend.testutil.RecordingEmailProvider;
import io.veomenu.backend.testutil.RecordingSmsProvider;
import io.veomenu.backend.testutil.TestConfig;
import io.veomenu.backend.user.UserRepository;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestConfig.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class MagicLinkIntegrationTest {

  private static final String GENERIC_MESSAGE =
      "If an account exists for this email, a login link has been sent.";

  @Autowired private MockMvc mockMvc;
  @Autowired private RecordingEmailProvider emailProvider;
  @Autowired private RecordingSmsProvider smsProvider;
  @Autowired private MutableClock clock;
  @Autowired private MagicLinkService magicLinkService;
  @Autowired private UserRepository userRepository;

  @AfterEach
  void resetClock() {
    clock.reset();
  }

  private RegisteredUser newUser(String prefix) throws Exception {
    return AuthTestSupport.registerUser(
        mockMvc, smsProvider, AuthTestSupport.uniqueEmail(prefix), "Link User");
  }

  private ResultActions requestLink(String email) throws Exception {
    return mockMvc.perform(
        post("/api/auth/request-magic-link")
            .contentType(MediaType.APPLICATION_JSON)
            .content(
                """
                {"email": "%s"}
                """
                    .formatted(email)));
  }

  private ResultActions verifyLink(String token) throws Exception {
    return mockMvc.perform(
        post("/api/auth/verify-magic-link")
            .contentType(MediaType.APPLICATION_JSON)
            .header("User-Agent", "JUnit/5")
            .content(
                """
                {"token": "%s"}
                """
                    .formatted(token)));
  }

  private String issueToken(String email) throws Exception {
    String body =
        requestLink(email)
            .andExpect(status().isOk())
            .andReturn()
            .getResponse()
            .getContentAsString();
    String url = JsonPath.read(body, "$.magicLink");
    return url.substring(url.indexOf("token=") + "token=".length());
  }

  private static long timed(ThrowingAction action) throws Exception {
    long start = System.nanoTime();
    action.run();
    return Duration.ofNanos(System.nanoTime() - start).toMillis();
  }

  @FunctionalInterface
  private interface ThrowingAction {
    void run() throws Exception;
  }

  @Nested
  class RequestMagicLink {

    @Test
    void unknownEmailGetsTheGenericAnswer() throws Exception {
      String email = AuthTestSupport.uniqueEmail("nobody");

      requestLink(email)
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.message").value(GENERIC_MESSAGE))
          .andExpect(jsonPath("$.magicLink").doesNotExist());
      assertThat(emailProvider.sentTo(email)).isEmpty();
    }

    @Test
    void knownEmailGetsTheSameMessageAndAnEmail() throws Exception {
      var user = newUser("known");

      requestLink(user.email())
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.message").value(GENERIC_MESSAGE))
          .andExpect(jsonPath("$.magicLink").value(containsString("token=")));

      String emailed = emailProvider.lastMagicLinkTokenFor(user.email());
      assertThat(emailed).isNotBlank();
    }

    @Test
    void slowMailTransportDoesNotDelayTheAnswerForKnownEmails() throws Exception {
      var user = newUser("slow-mail");
      String unknown = AuthTestSupport.uniqueEmail("slow-nobody");
      emailProvider.setLatency(Duration.ofMillis(1500));
      try {
        long unknownMillis = timed(() -> requestLink(unknown).andExpect(status().isOk()));
        long knownMillis = timed(() -> requestLink(user.email()).andExpect(status().isOk()));

        assertThat(knownMillis).isLessThan(1000);
        assertThat(Math.abs(knownMillis - unknownMillis)).isLessThan(500);
        assertThat(emailProvider.lastMagicLinkTokenFor(user.email())).isNotBlank();
      } finally {
        emailProvider.setLatency(Duration.ZERO);
      }
    }

    @Test
    void oversizedForwardedForHeaderIsNotStored() throws Exception {
      var user = newUser("forwarded");

      mockMvc
          .perform(
              post("/api/auth/request-magic-link")
                  .contentType(MediaType.APPLICATION_JSON)
                  .header("X-Forwarded-For", "9".repeat(300) + ", 10.0.0.1")
                  .content(
                      """
                      {"email": "%s"}
                      """
                          .formatted(user.email())))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.magicLink").exists());
    }

    @Test
    void fourthRequestInsideTheWindowIsSilentlyDropped() throws Exception {
      var user = newUser("ratelimit");

      for (int i = 0; i < 3; i++) {
        requestLink(user.email())
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.magicLink").exists());
      }

      requestLink(user.email())
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.message").value(GENERIC_MESSAGE))
          .andExpect(jsonPath("$.magicLink").doesNotExist());
    }

    @Test
    void rateLimitWindowSlides() throws Exception {
      var user = newUser("window");
      for (int i = 0; i < 3; i++) {
        requestLink(user.email()).andExpect(status().isOk());
      }

      clock.advance(Duration.ofMinutes(6));

      requestLink(user.email())
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.magicLink").exists());
    }
  }

  @Nested
  class VerifyMagicLink {

    @Test
    void validTokenOpensASession() throws Exception {
      var user = newUser("verify-link");
      String token = issueToken(user.email());

      verifyLink(token)
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.session.accessToken").isNotEmpty())
          .andExpect(jsonPath("$.session.refreshToken").isNotEmpty())
          .andExpect(jsonPath("$.user.id").value(user.userId().toString()));
    }

    @Test
    void tokenIsSingleUse() throws Exception {
      var user = newUser("single-use");
      String token = issueToken(user.email());

      verifyLink(token).andExpect(status().isOk());
      verifyLink(token)
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.title").value("Invalid magic link"));
    }

    @Test
    void unknownTokenIsIndistinguishableFromAUsedOne() throws Exception {
      verifyLink("not-a-real-token")
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.title").value("Invalid magic link"));
    }

    @Test
    void expiredTokenIsGone() throws Exception {
      var user = newUser("expired-link");
      String token = issueToken(user.email());

      clock.advance(Duration.ofMinutes(16));

      verifyLink(token)
          .andExpect(status().isGone())
          .andExpect(jsonPath("$.title").value("Credential expired"));
    }

    @Test
    void parallelConsumptionOfOneLinkSucceedsOnce() throws Exception {
      var user = newUser("race-link");
      String url =
          magicLinkService.issue(userRepository.findById(user.userId()).orElseThrow(), null).url();
      String token = url.substring(url.indexOf("token=") + "token=".length());

      int threads = 8;
      ExecutorService pool = Executors.newFixedThreadPool(threads);
      List<Boolean> consumed = new ArrayList<>();
      try {
        var start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
          futures.add(
              pool.submit(
                  () -> {
                    start.await();
                    try {
                      magicLinkService.verifyAndConsume(token);
                      return true;
                    } catch (InvalidVerificationCodeException e) {
                      return false;
                    }
                  }));
        }
        start.countDown();
        for (Future<Boolean> future : futures) {
          consumed.add(future.get(30, TimeUnit.SECONDS));
        }
      } finally {
        pool.shutdownNow();
      }

      assertThat(consumed).filteredOn(Boolean::booleanValue).hasSize(1);
      verifyLink(token).andExpect(status().isBadRequest());
    }

    @Test
    void earlierLinksStayValidWhenANewOneIsIssued() throws Exception {
      var user = newUser("two-links");
      String first = issueToken(user.email());
      String second = issueToken(user.email());

      verifyLink(first).andExpect(status().isOk());
      verifyLink(second).andExpect(status().isOk());
    }
  }
}
