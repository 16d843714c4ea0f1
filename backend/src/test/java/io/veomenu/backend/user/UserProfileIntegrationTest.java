package io.veomenu.backend.user;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.veomenu.backend.testutil.AuthTestSupport;
import io.veomenu.backend.testutil.RecordingSmsProvider;
import io.veomenu.backend.testutil.TestConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
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
class UserProfileIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private RecordingSmsProvider smsProvider;
  @Autowired private UserRepository userRepository;

  private ResultActions patchProfile(AuthTestSupport.RegisteredUser user, String json)
      throws Exception {
    return mockMvc.perform(
        patch("/api/users/me")
            .header("Authorization", user.bearer())
            .contentType(MediaType.APPLICATION_JSON)
            .content(json));
  }

  @Test
  void updatesNameAndLanguage() throws Exception {
    var user =
        AuthTestSupport.registerUser(
            mockMvc, smsProvider, AuthTestSupport.uniqueEmail("profile"), "Old Name");

    patchProfile(
            user,
            """
            {"name": " New Name ", "language": "pt"}
            """)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("New Name"))
        .andExpect(jsonPath("$.language").value("pt"))
        .andExpect(jsonPath("$.phone").value(user.phone()))
        .andExpect(jsonPath("$.email").value(user.email()));
  }

  @Test
  void phoneCannotBeChangedWithoutVerification() throws Exception {
    var user =
        AuthTestSupport.registerUser(
            mockMvc, smsProvider, AuthTestSupport.uniqueEmail("profile-phone"), "Phone Owner");

    patchProfile(
            user,
            """
            {"name": "Renamed", "phone": "00 44 7700 900123"}
            """)
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Phone change requires verification"));

    var stored = userRepository.findById(user.userId()).orElseThrow();
    assertThat(stored.getPhone()).isEqualTo(user.phone());
    assertThat(stored.getName()).isEqualTo("Phone Owner");
  }

  @ParameterizedTest
  @ValueSource(strings = {"   ", "\\t", ""})
  void blankNameIsRejected(String name) throws Exception {
    var user =
        AuthTestSupport.registerUser(
            mockMvc, smsProvider, AuthTestSupport.uniqueEmail("profile-blank"), "Kept Name");

    patchProfile(
            user,
            """
            {"name": "%s"}
            """
                .formatted(name))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Validation failed"))
        .andExpect(jsonPath("$.errors.name").exists());

    assertThat(userRepository.findById(user.userId()).orElseThrow().getName())
        .isEqualTo("Kept Name");
  }

  @Test
  void deactivatedAccountGetsNoMagicLink() throws Exception {
    var user =
        AuthTestSupport.registerUser(
            mockMvc, smsProvider, AuthTestSupport.uniqueEmail("inactive"), "Gone");
    var entity = userRepository.findById(user.userId()).orElseThrow();
    entity.deactivate();
    userRepository.save(entity);

    mockMvc
        .perform(
            post("/api/auth/request-magic-link")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"email": "%s"}
                    """
                        .formatted(user.email())))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.magicLink").doesNotExist());
  }
}
