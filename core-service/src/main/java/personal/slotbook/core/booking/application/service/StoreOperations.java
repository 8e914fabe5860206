package personal.slotbook.core.booking.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;
import personal.slotbook.core.booking.domain.exception.StoreUnavailableException;

import java.util.function.Supplier;

/**
 * 저장소 호출 래퍼
 * 트랜잭션 바깥(커밋 이후)에서 감싸야 커밋 실패까지 StoreUnavailableException으로 변환됨
 * 비즈니스 예외(충돌 등)는 그대로 전파
 */
@Slf4j
final class StoreOperations {

    private StoreOperations() {
    }

    static <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Store failure: operation={}", operation, e);
            throw new StoreUnavailableException(operation, e);
        }
    }

    static void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }
}
