package com.qaradar.core.service;

import com.qaradar.core.config.Doctrine;
import com.qaradar.core.model.DiscoveryBrief;
import com.qaradar.core.model.DiscoveryHealth;
import com.qaradar.core.model.FetchError;
import com.qaradar.core.model.Origin;
import com.qaradar.core.model.PageRecord;
import com.qaradar.core.model.RunStats;
import com.qaradar.core.model.TrustDomain;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 분류·채점된 페이지들을 도메인별로 묶어 최종 브리프를 만든다.
 * - 그룹 순서는 TrustDomain 선언 순서, 그룹 내부는 삽입 순서
 * - discovery health는 페이지 수로만 정한다(신호 내용과 무관)
 * - archetype은 참고용
 */
public final class BriefAssembler {

    private final Doctrine doctrine;
    private final ArchetypeGuesser archetypes;
    private final Clock clock;

    public BriefAssembler() {
        this(Doctrine.DEFAULT, new ArchetypeGuesser(), Clock.systemUTC());
    }

    public BriefAssembler(Doctrine doctrine, ArchetypeGuesser archetypes, Clock clock) {
        this.doctrine = Objects.requireNonNull(doctrine, "doctrine");
        this.archetypes = Objects.requireNonNull(archetypes, "archetypes");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public DiscoveryBrief assemble(Origin origin,
                                   List<PageRecord> pageRecords,
                                   List<FetchError> fetchErrors,
                                   String homepageHtml,
                                   boolean strictMode,
                                   RunStats.Snapshot stats) {
        Objects.requireNonNull(origin, "origin");
        List<PageRecord> records = (pageRecords == null ? List.of() : pageRecords);

        return DiscoveryBrief.builder()
                .origin(origin)
                .discoveryHealth(DiscoveryHealth.fromYield(records.size()))
                .archetype(archetypes.guess(homepageHtml))
                .strictMode(strictMode)
                .pages(groupByDomain(records))
                .fetchErrors(fetchErrors)
                .timestamp(clock.instant())
                .doctrine(doctrine)
                .stats(stats)
                .build();
    }

    static List<PageRecord> groupByDomain(List<PageRecord> records) {
        List<PageRecord> out = new ArrayList<>(records.size());
        for (TrustDomain d : TrustDomain.values()) {
            for (PageRecord r : records) {
                if (r.getTrustDomain() == d) out.add(r);
            }
        }
        return out;
    }

    public Doctrine doctrine() { return doctrine; }
}
