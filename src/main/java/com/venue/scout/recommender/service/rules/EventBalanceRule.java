package com.venue.scout.recommender.service.rules;

import com.venue.scout.recommender.common.constants.RankingProperties;
import com.venue.scout.recommender.model.scoring.ScoredCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Caps time-bound candidates in the top-N and guarantees a minimum of them inside a wider window.
 *
 * <p>The excess events with the lowest final score are demoted, wherever earlier swaps put them.
 * Moves are positional: demoted events go right behind the top-N, promoted events go to the
 * tail of the window. The list is not re-sorted afterwards so the diversity swaps survive.
 * Events already under way are never promoted.
 */
@Component
@Slf4j
public class EventBalanceRule implements RankingRule {

    private final RankingProperties props;

    public EventBalanceRule(RankingProperties props) {
        this.props = props;
    }

    @Override
    public String name() {
        return "event-balance";
    }

    @Override
    public List<ScoredCandidate> apply(List<ScoredCandidate> ranked) {
        List<ScoredCandidate> list = new ArrayList<>(ranked);
        capTop(list);
        guaranteeWindow(list);
        return list;
    }

    private void capTop(List<ScoredCandidate> list) {
        RankingProperties.EventBalance e = props.getEventBalance();
        int topN = Math.min(e.getTopN(), list.size());

        List<Integer> eventIdx = new ArrayList<>();
        for (int i = 0; i < topN; i++) if (list.get(i).isTimeBound()) eventIdx.add(i);
        int excess = eventIdx.size() - e.getMaxEventsInTopN();
        if (excess <= 0) return;

        int replacements = 0;
        for (int i = topN; i < list.size(); i++) if (!list.get(i).isTimeBound()) replacements++;
        excess = Math.min(excess, replacements);
        if (excess <= 0) return;

        // lowest final score leaves first; on a tie the one further down goes
        eventIdx.sort(Comparator.<Integer>comparingDouble(i -> list.get(i).getFinalScore())
                .thenComparing(Comparator.reverseOrder()));
        List<Integer> out = new ArrayList<>(eventIdx.subList(0, excess));
        out.sort(Comparator.reverseOrder());
        List<ScoredCandidate> demoted = new ArrayList<>(excess);
        for (int idx : out) demoted.add(list.remove(idx));

        // refill the top-N with non-events only; events found on the way are kept behind them
        List<ScoredCandidate> parked = new ArrayList<>();
        int head = topN - excess;
        while (head < topN && head < list.size()) {
            ScoredCandidate next = list.get(head);
            if (next.isTimeBound()) {
                parked.add(list.remove(head));
            } else {
                head++;
            }
        }
        List<ScoredCandidate> behind = new ArrayList<>(demoted);
        behind.addAll(parked);
        behind.sort(ScoredCandidate.BY_SCORE_DESC);
        list.addAll(Math.min(head, list.size()), behind);
        log.debug("rules.event-balance: demoted {} events out of top {}", demoted.size(), topN);
    }

    private void guaranteeWindow(List<ScoredCandidate> list) {
        RankingProperties.EventBalance e = props.getEventBalance();
        int window = Math.min(e.getGuaranteeWindow(), list.size());
        int inWindow = 0;
        for (int i = 0; i < window; i++) if (list.get(i).isTimeBound()) inWindow++;
        int needed = e.getMinEventsInWindow() - inWindow;
        if (needed <= 0 || window == 0) return;

        List<ScoredCandidate> promoted = new ArrayList<>();
        for (int i = window; i < list.size() && promoted.size() < needed; i++) {
            ScoredCandidate sc = list.get(i);
            if (sc.isTimeBound() && !sc.isPassedEvent()) promoted.add(sc);
        }
        if (promoted.isEmpty()) return;

        // swap with the lowest non-events of the window tail; the displaced entries go right behind the window
        List<Integer> victims = new ArrayList<>();
        for (int i = window - 1; i >= Math.min(e.getTopN(), window) && victims.size() < promoted.size(); i--) {
            if (!list.get(i).isTimeBound()) victims.add(0, i);
        }
        List<ScoredCandidate> moving = promoted.subList(0, victims.size());
        for (int k = 0; k < victims.size(); k++) {
            ScoredCandidate event = moving.get(k);
            int v = victims.get(k);
            ScoredCandidate displaced = list.get(v);
            list.remove(list.indexOf(event));
            list.set(v, event);
            list.add(window, displaced);
        }
        log.debug("rules.event-balance: promoted {} events into top {}", moving.size(), window);
    }
}
