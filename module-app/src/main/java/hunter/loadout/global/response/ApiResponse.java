package hunter.loadout.global.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * API 공통 성공 응답 포맷
 *
 * <p>실패 응답은 {@link hunter.loadout.error.dto.ErrorResponse}를 사용합니다.
 *
 * @param success 성공 여부
 * @param data 응답 데이터
 * @param <T> 응답 데이터 타입
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data) {
  /** 성공 응답 생성 */
  public static <T> ApiResponse<T> success(T data) {
    return new ApiResponse<>(true, data);
  }
}
