package com.tradecontrol.domain.enums;

public enum PhaseAction {
    ADVANCE,
    MAINTAIN,
    REVERT,
    /** Drop straight to phase 0 on sustained losses. */
    FORCE_REVERT,
    /** Phase pinned by an operator; automatic evaluation suspended. */
    MANUAL
}
