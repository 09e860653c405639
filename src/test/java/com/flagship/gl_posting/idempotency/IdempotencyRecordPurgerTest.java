package com.flagship.gl_posting.idempotency;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.flagship.gl_posting.TestLedger.CLOCK;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdempotencyRecordPurgerTest {

    @Mock
    private IdempotencyRecordRepository repository;

    @Test
    @DisplayName("Rows expired as of now are deleted")
    void purgesAsOfNow() {
        when(repository.deleteExpired(CLOCK.instant())).thenReturn(3);

        new IdempotencyRecordPurger(repository, CLOCK).purgeExpired();

        verify(repository).deleteExpired(CLOCK.instant());
    }
}
