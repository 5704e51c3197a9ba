package com.scholary.speech.gateway.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.speech.gateway.testutil.TestProperties;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
class ModelResolverTest {

  private static final Duration TIMEOUT = Duration.ofMillis(200);

  @Mock private EntitlementService entitlementService;

  private ThreadPoolTaskExecutor executor;
  private ModelResolver resolver;

  @BeforeEach
  void setUp() {
    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(10);
    executor.initialize();

    AccessProperties properties = TestProperties.access(TIMEOUT);
    resolver =
        new ModelResolver(new ModelCatalog(properties), entitlementService, executor, properties);
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
  }

  @Test
  void baselineModel_isAllowedWithoutAskingEntitlements() {
    AccessDecision decision = resolver.resolve(request("gemini-2.5-flash", Role.NORMAL_USER));

    assertThat(decision.allowed()).isTrue();
    assertThat(decision.resolvedModel()).isEqualTo("gemini-2.5-flash");
    verifyNoInteractions(entitlementService);
  }

  @Test
  void blankModel_resolvesToBaseline() {
    AccessDecision decision = resolver.resolve(request(null, Role.NORMAL_USER));

    assertThat(decision.resolvedModel()).isEqualTo("gemini-2.5-flash");
    assertThat(decision.degraded()).isFalse();
  }

  @Test
  void deprecatedAlias_isCanonicalizedBeforeTheCheck() {
    when(entitlementService.checkModelAccess(
            "user-1", "gemini-2.5-flash-preview-05-20", ServiceType.TRANSCRIPTION))
        .thenReturn(AccessDecision.allow("gemini-2.5-flash-preview-05-20", "basic plan"));

    AccessDecision decision =
        resolver.resolve(request("gemini-2.5-flash-preview-04-17", Role.NORMAL_USER));

    assertThat(decision.allowed()).isTrue();
    assertThat(decision.resolvedModel()).isEqualTo("gemini-2.5-flash-preview-05-20");
  }

  @Test
  void privilegedRoles_skipTheCheck() {
    AccessDecision admin = resolver.resolve(request("gemini-2.5-pro", Role.ADMIN));
    AccessDecision superUser = resolver.resolve(request("gemini-2.5-pro", Role.SUPER_USER));

    assertThat(admin.allowed()).isTrue();
    assertThat(admin.resolvedModel()).isEqualTo("gemini-2.5-pro");
    assertThat(superUser.allowed()).isTrue();
    verifyNoInteractions(entitlementService);
  }

  @Test
  void unknownModel_isDeniedWithBaselineAlternative() {
    AccessDecision decision = resolver.resolve(request("made-up-model", Role.NORMAL_USER));

    assertThat(decision.allowed()).isFalse();
    assertThat(decision.resolvedModel()).isEqualTo("gemini-2.5-flash");
    assertThat(decision.reason()).contains("Unknown model");
    verifyNoInteractions(entitlementService);
  }

  @Test
  void refusedModel_suggestsBaseline() {
    when(entitlementService.checkModelAccess(
            "user-1", "gemini-2.5-pro", ServiceType.TRANSCRIPTION))
        .thenReturn(AccessDecision.deny(null, "requires the professional plan"));

    AccessDecision decision = resolver.resolve(request("gemini-2.5-pro", Role.NORMAL_USER));

    assertThat(decision.allowed()).isFalse();
    assertThat(decision.degraded()).isFalse();
    assertThat(decision.requireUsableModel()).isEqualTo("gemini-2.5-flash");
    assertThat(decision.reason()).isEqualTo("requires the professional plan");
  }

  @Test
  void refusalWithoutBaselineSupport_hasNoAlternative() {
    when(entitlementService.checkModelAccess("user-1", "gpt4o-mini", ServiceType.TTS))
        .thenReturn(AccessDecision.deny(null, "requires the basic plan"));

    AccessDecision decision =
        resolver.resolve(
            new ModelRequest("gpt4o-mini", Role.NORMAL_USER, "s-1", "user-1", ServiceType.TTS));

    assertThat(decision.resolvedModel()).isNull();
    assertThatThrownBy(decision::requireUsableModel)
        .isInstanceOf(AccessDeniedException.class);
  }

  @Test
  void slowEntitlementCheck_degradesToBaselineWithinDeadline() throws InterruptedException {
    CountDownLatch release = new CountDownLatch(1);
    when(entitlementService.checkModelAccess(
            anyString(), eq("gemini-2.5-pro"), eq(ServiceType.TRANSCRIPTION)))
        .thenAnswer(
            invocation -> {
              release.await(5, TimeUnit.SECONDS);
              return AccessDecision.allow("gemini-2.5-pro", "late answer");
            });

    long start = System.nanoTime();
    AccessDecision decision = resolver.resolve(request("gemini-2.5-pro", Role.NORMAL_USER));
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    release.countDown();

    assertThat(decision.degraded()).isTrue();
    assertThat(decision.allowed()).isTrue();
    assertThat(decision.resolvedModel()).isEqualTo("gemini-2.5-flash");
    assertThat(decision.reason()).contains("timed out");
    assertThat(elapsedMs).isLessThan(TIMEOUT.toMillis() + 500);
  }

  @Test
  void failingEntitlementCheck_degradesToBaseline() {
    when(entitlementService.checkModelAccess(
            "user-1", "gemini-2.5-pro", ServiceType.TRANSCRIPTION))
        .thenThrow(new IllegalStateException("backend unavailable"));

    AccessDecision decision = resolver.resolve(request("gemini-2.5-pro", Role.NORMAL_USER));

    assertThat(decision.degraded()).isTrue();
    assertThat(decision.resolvedModel()).isEqualTo("gemini-2.5-flash");
  }

  @Test
  void saturatedExecutor_degradesToBaselineWithoutRunningTheCheck() {
    // a shut-down pool rejects every submission with TaskRejectedException
    executor.shutdown();

    AccessDecision decision =
        resolver.resolve(request("gemini-2.5-flash-preview-05-20", Role.NORMAL_USER));

    assertThat(decision.allowed()).isTrue();
    assertThat(decision.degraded()).isTrue();
    assertThat(decision.resolvedModel()).isEqualTo("gemini-2.5-flash");
    assertThat(decision.reason()).contains("rejected");
    verifyNoInteractions(entitlementService);
  }

  @Test
  void checkUsage_deniesWhenOverQuota() {
    when(entitlementService.checkUsageAllowed("user-1", ServiceType.TRANSCRIPTION, 1.09))
        .thenReturn(UsageDecision.deny("limit reached"));

    UsageDecision decision =
        resolver.checkUsage("user-1", Role.NORMAL_USER, ServiceType.TRANSCRIPTION, 1.09, "s-1");

    assertThat(decision.allowed()).isFalse();
  }

  @Test
  void checkUsage_slowCheckDegradesToAllowed() {
    when(entitlementService.checkUsageAllowed(
            anyString(), eq(ServiceType.TRANSCRIPTION), anyDouble()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(2_000);
              return UsageDecision.deny("too late");
            });

    UsageDecision decision =
        resolver.checkUsage("user-1", Role.NORMAL_USER, ServiceType.TRANSCRIPTION, 1, "s-1");

    assertThat(decision.allowed()).isTrue();
    assertThat(decision.degraded()).isTrue();
  }

  @Test
  void checkUsage_privilegedRolesAreNotMetered() {
    UsageDecision decision =
        resolver.checkUsage("admin-1", Role.ADMIN, ServiceType.TRANSCRIPTION, 10_000, "s-1");

    assertThat(decision.allowed()).isTrue();
    verify(entitlementService, never())
        .checkUsageAllowed(anyString(), eq(ServiceType.TRANSCRIPTION), anyDouble());
  }

  private static ModelRequest request(String model, Role role) {
    return ModelRequest.transcription(model, role, "s-1", "user-1");
  }
}
