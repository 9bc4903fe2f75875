package com.worksync.schedule.schedules.model;

/**
 * 반복 일정 수정/삭제 범위
 */
public enum EditScope {
    /** 이 일정만 */
    SINGLE,
    /** 이 일정 및 이후 일정 */
    FUTURE,
    /** 모든 일정 */
    ALL
}
