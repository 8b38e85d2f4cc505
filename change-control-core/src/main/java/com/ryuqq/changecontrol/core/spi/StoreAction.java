package com.ryuqq.changecontrol.core.spi;

import com.ryuqq.changecontrol.core.generic.PartyProxy;

import java.time.Instant;
import java.util.Optional;

/**
 * Store의 객체별 감사 이력 항목 하나.
 *
 * @param type 접근 종류
 * @param occurredAt 발생 시각
 * @param actor 행동한 party (호출자가 알리지 않았으면 null)
 * @param detail 짧은 자유 텍스트 (예: update의 Contribution ID)
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public record StoreAction(
    StoreActionType type,
    Instant occurredAt,
    PartyProxy actor,
    String detail
) {

    public StoreAction {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
        if (detail == null) {
            detail = "";
        }
    }

    public Optional<PartyProxy> actingParty() {
        return Optional.ofNullable(actor);
    }
}
