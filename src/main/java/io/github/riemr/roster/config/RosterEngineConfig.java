package io.github.riemr.roster.config;

import io.github.riemr.roster.domain.model.ShiftScheme;
import io.github.riemr.roster.domain.rule.EligibilityRules;
import io.github.riemr.roster.domain.rule.HolidayImmunity;
import io.github.riemr.roster.engine.FairnessObjective;
import io.github.riemr.roster.engine.PointWeights;
import io.github.riemr.roster.engine.RosterModelBuilder;
import io.github.riemr.roster.engine.RosterProjector;
import io.github.riemr.roster.optimization.service.LocalSearchSolvingService;
import io.github.riemr.roster.solver.CpSatSolvingService;
import io.github.riemr.roster.solver.SolvingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Duration;

@Configuration
@Slf4j
public class RosterEngineConfig {

    @Value("${roster.calendar.scheme:SPLIT}")
    private String scheme;
    // 平日の午前枠も充足対象にするか（既定: 夕方のみ）
    @Value("${roster.calendar.weekday-morning-covered:false}")
    private boolean weekdayMorningCovered;
    @Value("${roster.eligibility.immunity-years:2}")
    private int immunityYears;

    @Value("${roster.points.regular-weight:10}")
    private int regularWeight;
    @Value("${roster.points.premium-weight:15}")
    private int premiumWeight;
    @Value("${roster.points.scale:10}")
    private int scale;

    // cp-sat | local-search
    @Value("${roster.solver.backend:cp-sat}")
    private String backend;
    @Value("${roster.solver.time-budget:PT10S}")
    private String timeBudget;
    // 0 = CP-SAT の既定ワーカー数
    @Value("${roster.solver.cp-sat.workers:0}")
    private int cpSatWorkers;
    @Value("${roster.solver.cp-sat.random-seed:#{null}}")
    private Integer cpSatRandomSeed;
    @Value("${roster.solver.local-search.unimproved-limit:PT2S}")
    private String localSearchUnimprovedLimit;

    @Bean
    public RosterSettings rosterSettings() {
        ShiftScheme resolved = ShiftScheme.fromCode(scheme);
        return new RosterSettings(
                resolved == null ? ShiftScheme.SPLIT : resolved,
                weekdayMorningCovered,
                immunityYears,
                parseDurationTolerant(timeBudget, Duration.ofSeconds(10)),
                backend == null ? "cp-sat" : backend.trim().toLowerCase(),
                new PointWeights(regularWeight, premiumWeight, scale),
                cpSatWorkers,
                cpSatRandomSeed,
                parseDurationTolerant(localSearchUnimprovedLimit, Duration.ofSeconds(2)));
    }

    @Bean
    public HolidayImmunity holidayImmunity(RosterSettings settings) {
        return new HolidayImmunity(settings.immunityYears());
    }

    @Bean
    public EligibilityRules eligibilityRules(HolidayImmunity holidayImmunity) {
        return new EligibilityRules(holidayImmunity);
    }

    @Bean
    public RosterModelBuilder rosterModelBuilder(EligibilityRules rules, RosterSettings settings) {
        return new RosterModelBuilder(rules, settings.weights());
    }

    @Bean
    public FairnessObjective fairnessObjective() {
        return new FairnessObjective();
    }

    @Bean
    public RosterProjector rosterProjector() {
        return new RosterProjector();
    }

    // LocalSearchSolvingService も SolvingService 型の Bean なので、こちらを既定にする
    @Bean
    @Primary
    public SolvingService solvingService(RosterSettings settings,
                                         ObjectProvider<LocalSearchSolvingService> localSearch) {
        SolvingService service = switch (settings.backend()) {
            case "local-search", "optaplanner" -> localSearch.getObject();
            case "cp-sat", "ortools" -> new CpSatSolvingService(settings.cpSatWorkers(), settings.cpSatRandomSeed());
            default -> throw new IllegalArgumentException("Unknown roster.solver.backend: " + settings.backend());
        };
        log.info("Roster solving backend: {} (budget {})", service.name(), settings.timeBudget());
        return service;
    }

    static Duration parseDurationTolerant(String raw, Duration def) {
        if (raw == null || raw.isBlank()) return def;
        String s = raw.trim();
        try {
            if (s.startsWith("P")) {
                if (s.matches("^PT\\d+$")) s = s + "S"; // fix common mistake
                return Duration.parse(s);
            }
            String ls = s.toLowerCase();
            if (ls.endsWith("ms")) return Duration.ofMillis(Long.parseLong(ls.substring(0, ls.length() - 2)));
            if (ls.endsWith("s")) return Duration.ofSeconds(Long.parseLong(ls.substring(0, ls.length() - 1)));
            if (ls.endsWith("m")) return Duration.ofMinutes(Long.parseLong(ls.substring(0, ls.length() - 1)));
            if (ls.matches("^\\d+$")) return Duration.ofSeconds(Long.parseLong(ls));
        } catch (RuntimeException e) {
            log.warn("Invalid duration '{}', using {}", raw, def);
            return def;
        }
        log.warn("Unrecognized duration '{}', using {}", raw, def);
        return def;
    }
}
