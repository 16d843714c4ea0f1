package io.veomenu.backend.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.veomenu.backend.testutil.AuthTestSupport;
import io.veomenu.backend.testutil.RecordingEmailProvider;
import io.veomenu.backend.testutil.RecordingSmsProvider;
import io.veomenu.backend.testutil.TestConfig;
import io.veomenu.backend.user.UserRepository;
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
class RegistrationIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private RecordingEmailProvider emailProvider;
  @Autowired private RecordingSmsProvider smsProvider;
  @Autowired private UserRepository userRepository;

  @AfterEach
  void restoreSms() {
    smsProvider.setFailing(false);
  }

  private ResultActions register(String email, String phone) throws Exception {
    return mockMvc.perform(
        post("/api/auth/register")
            .contentType(MediaType.APPLICATION_JSON)
            .content(
                """
                {"email": "%s", "name": "Ana Silva", "phone": "%s", "language": "pt-BR"}
                """
                    .formatted(email, phone)));
  }

  private ResultActions verify(String email, String phone, String code) throws Exception {
    return mockMvc.perform(
        post("/api/auth/verify-otp")
            .contentType(MediaType.APPLICATION_JSON)
            .content(
                """
                {"email": "%s", "phone": "%s", "otpCode": "%s"}
                """
                    .formatted(email, phone, code)));
  }

  private static String wrongCodeFor(String code) {
    return code.equals("000000") ? "999999" : "000000";
  }

  @Nested
  class Register {

    @Test
    void sendsTheSameCodeOverEmailAndSms() throws Exception {
      String email = AuthTestSupport.uniqueEmail("reg");
      String phone = AuthTestSupport.uniquePhone();

      register(email, phone)
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.expiresInMinutes").value(10))
          .andExpect(jsonPath("$.dispatch.email").value(true))
          .andExpect(jsonPath("$.dispatch.sms").value(true));

      assertThat(emailProvider.lastCodeFor(email)).isEqualTo(smsProvider.lastCodeFor(phone));
      assertThat(userRepository.existsByEmail(email)).isFalse();
    }

    @Test
    void reportsAFailedSmsChannelWithoutFailingTheRequest() throws Exception {
      String email = AuthTestSupport.uniqueEmail("reg-sms-down");
      smsProvider.setFailing(true);

      register(email, AuthTestSupport.uniquePhone())
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.dispatch.email").value(true))
          .andExpect(jsonPath("$.dispatch.sms").value(false));
    }

    @Test
    void normalizesEmailCase() throws Exception {
      String email = AuthTestSupport.uniqueEmail("mixedcase");
      String phone = AuthTestSupport.uniquePhone();
      register(email.toUpperCase(), phone).andExpect(status().isOk());

      verify(email, phone, smsProvider.lastCodeFor(phone))
          .andExpect(status().isCreated())
          .andExpect(jsonPath("$.user.email").value(email));
    }

    @Test
    void rejectsAnEmailThatAlreadyHasAnAccount() throws Exception {
      String email = AuthTestSupport.uniqueEmail("dup");
      AuthTestSupport.registerUser(mockMvc, smsProvider, email, "First");

      register(email, AuthTestSupport.uniquePhone())
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.title").value("Registration failed"));
    }

    @Test
    void rejectsInvalidInputWithFieldErrors() throws Exception {
      mockMvc
          .perform(
              post("/api/auth/register")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      """
                      {"email": "not-an-email", "name": "", "phone": "+351912345678"}
                      """))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.title").value("Validation failed"))
          .andExpect(jsonPath("$.errors.email").value("invalid email format"))
          .andExpect(jsonPath("$.errors.name").exists());
    }

    @Test
    void rejectsAnUnparseablePhoneNumber() throws Exception {
      register(AuthTestSupport.uniqueEmail("badphone"), "12").andExpect(status().isBadRequest());
    }
  }

  @Nested
  class VerifyOtp {

    @Test
    void createsTheAccountAndOpensASession() throws Exception {
      String email = AuthTestSupport.uniqueEmail("verify");
      String phone = AuthTestSupport.uniquePhone();
      register(email, phone).andExpect(status().isOk());

      verify(email, phone, smsProvider.lastCodeFor(phone))
          .andExpect(status().isCreated())
          .andExpect(jsonPath("$.session.tokenType").value("Bearer"))
          .andExpect(jsonPath("$.session.accessToken").isNotEmpty())
          .andExpect(jsonPath("$.session.refreshToken").isNotEmpty())
          .andExpect(jsonPath("$.session.expiresIn").value(3600))
          .andExpect(jsonPath("$.user.email").value(email))
          .andExpect(jsonPath("$.user.phone").value(phone))
          .andExpect(jsonPath("$.user.language").value("pt-BR"));

      assertThat(userRepository.existsByEmail(email)).isTrue();
    }

    @Test
    void issuedSessionAuthenticatesTheProfileEndpoint() throws Exception {
      var user =
          AuthTestSupport.registerUser(
              mockMvc, smsProvider, AuthTestSupport.uniqueEmail("me"), "Me Myself");

      mockMvc
          .perform(get("/api/users/me").header("Authorization", user.bearer()))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.user.id").value(user.userId().toString()))
          .andExpect(jsonPath("$.user.name").value("Me Myself"))
          .andExpect(jsonPath("$.user.lastLogin").isNotEmpty())
          .andExpect(jsonPath("$.instances").isEmpty());
    }

    @Test
    void wrongCodeReportsRemainingAttempts() throws Exception {
      String email = AuthTestSupport.uniqueEmail("wrong");
      String phone = AuthTestSupport.uniquePhone();
      register(email, phone).andExpect(status().isOk());
      String code = smsProvider.lastCodeFor(phone);

      verify(email, phone, wrongCodeFor(code))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.title").value("Invalid verification code"))
          .andExpect(jsonPath("$.remainingAttempts").value(2));
    }

    @Test
    void exhaustedChallengeRefusesEvenTheCorrectCode() throws Exception {
      String email = AuthTestSupport.uniqueEmail("exhaust");
      String phone = AuthTestSupport.uniquePhone();
      register(email, phone).andExpect(status().isOk());
      String code = smsProvider.lastCodeFor(phone);

      verify(email, phone, wrongCodeFor(code)).andExpect(status().isBadRequest());
      verify(email, phone, wrongCodeFor(code))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.remainingAttempts").value(1));
      verify(email, phone, wrongCodeFor(code)).andExpect(status().isGone());

      verify(email, phone, code)
          .andExpect(status().isGone())
          .andExpect(jsonPath("$.title").value("Too many attempts"));
      assertThat(userRepository.existsByEmail(email)).isFalse();
    }

    @Test
    void codeCannotBeUsedTwice() throws Exception {
      String email = AuthTestSupport.uniqueEmail("twice");
      String phone = AuthTestSupport.uniquePhone();
      register(email, phone).andExpect(status().isOk());
      String code = smsProvider.lastCodeFor(phone);

      verify(email, phone, code).andExpect(status().isCreated());
      verify(email, phone, code)
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.remainingAttempts").doesNotExist());
    }

    @Test
    void unknownRegistrationIsIndistinguishableFromAUsedCode() throws Exception {
      verify(AuthTestSupport.uniqueEmail("ghost"), AuthTestSupport.uniquePhone(), "123456")
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.title").value("Invalid verification code"));
    }

    @Test
    void rejectsMalformedCodes() throws Exception {
      verify(AuthTestSupport.uniqueEmail("malformed"), AuthTestSupport.uniquePhone(), "12ab")
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.errors.otpCode").value("otpCode must be 6 digits"));
    }
  }

  @Nested
  class ResendOtp {

    @Test
    void resendIssuesAFreshCodeAndResetsAttempts() throws Exception {
      String email = AuthTestSupport.uniqueEmail("resend");
      String phone = AuthTestSupport.uniquePhone();
      register(email, phone).andExpect(status().isOk());
      String first = smsProvider.lastCodeFor(phone);
      verify(email, phone, wrongCodeFor(first)).andExpect(status().isBadRequest());

      mockMvc
          .perform(
              post("/api/auth/resend-otp")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      """
                      {"email": "%s", "phone": "%s"}
                      """
                          .formatted(email, phone)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.dispatch.email").value(true));

      String second = smsProvider.lastCodeFor(phone);
      if (!second.equals(first)) {
        verify(email, phone, first)
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.remainingAttempts").value(2));
      }
      verify(email, phone, second).andExpect(status().isCreated());
    }

    @Test
    void resendWithoutPendingRegistrationFails() throws Exception {
      mockMvc
          .perform(
              post("/api/auth/resend-otp")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      """
                      {"email": "%s", "phone": "%s"}
                      """
                          .formatted(
                              AuthTestSupport.uniqueEmail("noresend"),
                              AuthTestSupport.uniquePhone())))
          .andExpect(status().isBadRequest());
    }
  }
}
