package xyz.firestige.rollout.facade.dto;

import java.time.LocalDateTime;

/**
 * 一条状态转换历史
 */
public record TransitionView(String from, String to, String reasonCode, String diagnostic, LocalDateTime timestamp) {
}
