package hunter.loadout.error;

import static org.assertj.core.api.Assertions.assertThat;

import hunter.loadout.error.exception.CatalogInconsistencyException;
import hunter.loadout.error.exception.InvalidOptimizationRequestException;
import hunter.loadout.error.exception.SolverInternalException;
import hunter.loadout.error.exception.SolverTimeoutException;
import hunter.loadout.error.exception.base.ClientBaseException;
import hunter.loadout.error.exception.base.ServerBaseException;
import java.time.Duration;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CommonErrorCodeTest {

  @ParameterizedTest(name = "{0} -> {1} / {2}")
  @CsvSource({
    "INVALID_INPUT_VALUE, C001, 400",
    "CATALOG_INCONSISTENT, C002, 422",
    "INTERNAL_SERVER_ERROR, S001, 500",
    "LOADOUT_INFEASIBLE, S002, 500",
    "SOLVER_TIMEOUT, S003, 503",
    "SOLVE_CANCELLED, S004, 503",
    "SOLVER_INTERNAL_ERROR, S005, 500",
    "CATALOG_LOAD_FAILED, S006, 500"
  })
  @DisplayName("에러 코드와 HTTP 상태 매핑")
  void codeAndStatus(CommonErrorCode errorCode, String code, int status) {
    assertThat(errorCode.getCode()).isEqualTo(code);
    assertThat(errorCode.getStatusCode()).isEqualTo(status);
  }

  @Test
  @DisplayName("코드는 중복되지 않는다")
  void codesAreUnique() {
    long distinct =
        Arrays.stream(CommonErrorCode.values()).map(ErrorCode::getCode).distinct().count();

    assertThat(distinct).isEqualTo(CommonErrorCode.values().length);
  }

  @Test
  @DisplayName("클라이언트 예외는 4xx, 서버 예외는 5xx 코드를 가진다")
  void hierarchyMatchesStatusFamily() {
    ClientBaseException invalid = new InvalidOptimizationRequestException("weight < 0");
    ClientBaseException inconsistent = new CatalogInconsistencyException("no weapon");
    ServerBaseException timeout = new SolverTimeoutException(Duration.ofSeconds(3));
    ServerBaseException internal =
        new SolverInternalException("loadout", new IllegalStateException("boom"));

    assertThat(invalid.getErrorCode().getStatus().is4xxClientError()).isTrue();
    assertThat(inconsistent.getErrorCode().getStatus().is4xxClientError()).isTrue();
    assertThat(timeout.getErrorCode().getStatus().is5xxServerError()).isTrue();
    assertThat(internal.getErrorCode().getStatus().is5xxServerError()).isTrue();
  }

  @Test
  @DisplayName("메시지 템플릿에 동적 인자가 채워지고 cause가 보존된다")
  void formatsMessageAndKeepsCause() {
    IllegalStateException cause = new IllegalStateException("boom");
    SolverInternalException e = new SolverInternalException("loadout-42", cause);

    assertThat(e.getMessage()).contains("loadout-42");
    assertThat(e.getCause()).isSameAs(cause);
    assertThat(new SolverTimeoutException(Duration.ofSeconds(3)).getMessage()).contains("PT3S");
  }
}
