package com.worksync.schedule.schedules.service;

import com.worksync.schedule.internal.client.AssigneeDirectoryClient;
import com.worksync.schedule.schedules.exception.InvalidScheduleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EntryValidator 테스트")
class EntryValidatorTest {

    private static final String TENANT_ID = "tenant-a";

    @Mock
    private AssigneeDirectoryClient assigneeDirectoryClient;

    @InjectMocks
    private EntryValidator entryValidator;

    @Test
    @DisplayName("종료가 시작과 같으면 InvalidScheduleException")
    void validateTimes_emptyInterval() {
        Instant start = Instant.parse("2024-01-10T09:00:00Z");

        assertThrows(InvalidScheduleException.class, () -> entryValidator.validateTimes(start, start));
    }

    @Test
    @DisplayName("담당자 중복과 공백 제거 (첫 등장 순서 유지)")
    void normalizeAssignees_dedupes() {
        when(assigneeDirectoryClient.findUnknownUserIds(eq(TENANT_ID), anyList())).thenReturn(Set.of());

        List<String> assignees = entryValidator.normalizeAssignees(TENANT_ID, Arrays.asList("bob", " alice ", "bob", "", null));

        assertThat(assignees).containsExactly("bob", "alice");
        verify(assigneeDirectoryClient).findUnknownUserIds(TENANT_ID, List.of("bob", "alice"));
    }

    @Test
    @DisplayName("담당자가 없으면 InvalidScheduleException")
    void normalizeAssignees_empty() {
        assertThrows(InvalidScheduleException.class, () -> entryValidator.normalizeAssignees(TENANT_ID, List.of()));
        verifyNoInteractions(assigneeDirectoryClient);
    }

    @Test
    @DisplayName("디렉터리에 없는 담당자면 InvalidScheduleException")
    void normalizeAssignees_unknown() {
        when(assigneeDirectoryClient.findUnknownUserIds(eq(TENANT_ID), anyList())).thenReturn(Set.of("ghost"));

        assertThatThrownBy(() -> entryValidator.normalizeAssignees(TENANT_ID, List.of("alice", "ghost")))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("ghost");
    }
}
