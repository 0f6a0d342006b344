package com.creditsim.simulator.planner;

import com.creditsim.common.model.AmountModel;
import com.creditsim.common.model.BehaviorProfile;
import com.creditsim.common.model.DebtSnapshot;
import com.creditsim.common.model.Participant;
import com.creditsim.common.model.PaymentIntent;
import com.creditsim.common.model.ScenarioSettings;
import com.creditsim.common.model.TrustLine;
import com.creditsim.simulator.run.RunState;
import com.creditsim.simulator.scenario.ScenarioGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Picks the payments a run attempts in one tick.
 *
 * <p>Output depends only on the run seed, tick index, intensity, simulated time, the
 * scenario mirror and the debt snapshot. All randomness comes from a tick seed and
 * per-visit seeds derived from it, so the same inputs give the same list, and lowering
 * intensity only shortens the list (the plan at lower intensity is a prefix of the
 * plan at higher intensity).
 */
@Component
public class PaymentPlanner {

    private static final Logger log = LoggerFactory.getLogger(PaymentPlanner.class);

    static final long SEED_MULTIPLIER   = 1_000_003L;
    static final long SEED_MASK         = 0xFFFFFFFFL;
    static final int  ITERATION_FACTOR  = 50;
    static final int  REACH_MAX_DEPTH   = 3;
    static final int  REACH_MAX_NODES   = 200;

    private static final double DEFAULT_WARMUP_FLOOR     = 0.1;
    private static final double DEFAULT_FLOW_AFFINITY    = 0.7;
    private static final double DEFAULT_PERIODICITY_P50  = 50.0;

    public static long tickSeed(long runSeed, long tickIndex) {
        return (runSeed * SEED_MULTIPLIER + tickIndex) & SEED_MASK;
    }

    public static long actionSeed(long tickSeed, int visit) {
        return (tickSeed * SEED_MULTIPLIER + visit) & SEED_MASK;
    }

    /**
     * Plans the current tick of {@code run}.
     *
     * @param snapshot debts at the start of the tick; when non-empty every usable limit is
     *                 reduced by the debt already drawn on it
     */
    public List<PaymentIntent> plan(RunState run, ScenarioGraph scenario, DebtSnapshot snapshot) {
        long tickIndex = run.getTickIndex();
        double intensity = effectiveIntensity(run.getIntensityPercent(), tickIndex, scenario.settings());
        int actionsMax = run.getSettings().actionsPerTickMax();
        int target = intensity > 0 ? Math.max(1, (int) (actionsMax * intensity)) : 0;
        if (target <= 0) {
            return List.of();
        }

        TickView view = new TickView(scenario, snapshot != null ? snapshot : DebtSnapshot.empty());
        if (view.candidates.isEmpty()) {
            return List.of();
        }

        long tickSeed = tickSeed(run.getSeed(), tickIndex);
        List<Candidate> order = new ArrayList<>(view.candidates);
        Collections.shuffle(order, new Random(tickSeed));

        StressMultipliers stress = StressMultipliers.compute(scenario.events(), run.getSimTimeMs());
        AmountSampler sampler = new AmountSampler(run.getSettings().amountCap());

        List<PaymentIntent> planned = new ArrayList<>(target);
        int maxIters = Math.max(1, target) * ITERATION_FACTOR;
        for (int i = 0; planned.size() < target && i < maxIters; i++) {
            Candidate c = order.get(i % order.size());
            BehaviorProfile profile = view.profileOf(c.sender());
            String senderGroup = view.groupOf(c.sender());

            double txRate = clamp01(profile.txRate(), 1.0) * stress.forSender(senderGroup, profile.id());
            double accept = clamp01(txRate, 1.0) * normWeight(profile.equivalentWeights(), c.equivalent());
            if (accept <= 0.0) continue;

            Random rng = new Random(actionSeed(tickSeed, i));
            if (rng.nextDouble() > accept) continue;

            String receiver = view.chooseReceiver(rng, c.equivalent(), c.sender(), profile);
            if (receiver == null) continue;

            BigDecimal limit = view.usableLimit(c, receiver);
            if (limit.signum() <= 0) continue;

            AmountModel model = profile.amountModelFor(c.equivalent());
            BigDecimal amount = sampler.pick(rng, limit, model);
            if (amount == null) continue;

            if (!passesPeriodicity(rng, profile, model, amount)) continue;

            planned.add(new PaymentIntent(planned.size(), c.equivalent(), c.sender(), receiver, amount));
        }

        log.debug("PLAN_BUILT runId={} tick={} target={} planned={}",
                  run.getRunId(), tickIndex, target, planned.size());
        return planned;
    }

    // ── intensity ──────────────────────────────────────────────────────────────

    static double effectiveIntensity(int intensityPercent, long tickIndex, ScenarioSettings settings) {
        double intensity = Math.max(0.0, Math.min(1.0, intensityPercent / 100.0));
        ScenarioSettings.Warmup warmup = settings != null ? settings.warmup() : null;
        int warmupTicks = warmup != null && warmup.ticks() != null ? warmup.ticks() : 0;
        if (warmupTicks > 0 && tickIndex < warmupTicks) {
            double floor = warmup.floor() != null ? warmup.floor() : DEFAULT_WARMUP_FLOOR;
            floor = Math.max(0.0, Math.min(1.0, floor));
            double ramp = floor + (1.0 - floor) * ((double) tickIndex / warmupTicks);
            intensity *= ramp;
        }
        return intensity;
    }

    // ── acceptance ─────────────────────────────────────────────────────────────

    /** Weight of {@code key} relative to the largest positive weight; 1 when no weights are set. */
    static double normWeight(Map<String, Double> weights, String key) {
        if (weights == null || weights.isEmpty()) return 1.0;
        double maxW = weights.values().stream()
            .filter(w -> w != null && w > 0)
            .mapToDouble(Double::doubleValue)
            .max()
            .orElse(0.0);
        if (maxW <= 0) return 0.0;
        Double w = weights.get(key);
        if (w == null || w <= 0) return 0.0;
        return Math.min(1.0, w / maxW);
    }

    /** Makes amounts far above the sender's typical amount progressively rarer. */
    static boolean passesPeriodicity(Random rng, BehaviorProfile profile, AmountModel model, BigDecimal amount) {
        double factor = profile.periodicityFactor() != null ? profile.periodicityFactor() : 1.0;
        if (factor == 1.0) return true;
        double value = amount.doubleValue();
        if (value <= 0) return true;
        double p50 = model != null && model.p50() != null ? model.p50() : DEFAULT_PERIODICITY_P50;
        if (p50 <= 0) return true;

        double den = 1.0 + Math.log(Math.max(value / p50, 0.1)) * factor;
        double accept = den <= 0 ? 0.0 : 1.0 / den;
        accept = Math.max(0.0, Math.min(1.0, accept));
        return !(rng.nextDouble() > accept);
    }

    private static double clamp01(Double value, double fallback) {
        if (value == null || !Double.isFinite(value)) return fallback;
        return Math.max(0.0, Math.min(1.0, value));
    }

    // ── per-tick view ──────────────────────────────────────────────────────────

    /** Payment-direction edge: {@code sender} (debtor) pays {@code receiver} (creditor). */
    record Candidate(String equivalent, String sender, String receiver, BigDecimal limit) {}

    /** Lookups derived once per tick from the scenario mirror and the debt snapshot. */
    private static final class TickView {

        private final ScenarioGraph               scenario;
        private final DebtSnapshot                snapshot;
        private final List<Candidate>             candidates         = new ArrayList<>();
        private final Map<String, BigDecimal>     maxOutgoing        = new HashMap<>();
        private final Map<String, BigDecimal>     maxIncoming        = new HashMap<>();
        private final Map<String, BigDecimal>     directLimit        = new HashMap<>();
        private final Map<String, String>         groupByPid         = new HashMap<>();
        private final Map<String, BehaviorProfile> profileByPid      = new HashMap<>();
        private final List<String>                allGroups;
        private final boolean                     flowEnabled;
        private final double                      flowDefaultAffinity;
        private final double                      reciprocityBonus;

        TickView(ScenarioGraph scenario, DebtSnapshot snapshot) {
            this.scenario = scenario;
            this.snapshot = snapshot;

            for (TrustLine tl : scenario.activeTrustLines()) {
                if (tl.limit() == null || tl.limit().signum() <= 0) continue;
                if (isBlank(tl.from()) || isBlank(tl.to()) || isBlank(tl.equivalent())) continue;
                Candidate c = new Candidate(tl.equivalent(), tl.to(), tl.from(), tl.limit());
                candidates.add(c);
                directLimit.put(edgeKey(c.sender(), c.receiver(), c.equivalent()), c.limit());
                maxOutgoing.merge(nodeKey(c.sender(), c.equivalent()), c.limit(), BigDecimal::max);
                maxIncoming.merge(nodeKey(c.receiver(), c.equivalent()), c.limit(), BigDecimal::max);
            }
            candidates.sort(Comparator.comparing(Candidate::equivalent)
                .thenComparing(Candidate::receiver)
                .thenComparing(Candidate::sender));

            Set<String> groups = new TreeSet<>();
            for (Participant p : scenario.participants()) {
                String group = scenario.groupOf(p.id());
                if (group != null) {
                    groupByPid.put(p.id(), group);
                    groups.add(group);
                }
                BehaviorProfile profile = scenario.profileOf(p.id());
                profileByPid.put(p.id(), profile != null ? profile : BehaviorProfile.defaults(null));
            }
            this.allGroups = new ArrayList<>(groups);

            ScenarioSettings.Flow flow = scenario.settings().flow();
            this.flowEnabled         = flow != null && Boolean.TRUE.equals(flow.enabled());
            this.flowDefaultAffinity = flow != null ? clamp01(flow.defaultAffinity(), DEFAULT_FLOW_AFFINITY) : DEFAULT_FLOW_AFFINITY;
            this.reciprocityBonus    = flow != null ? clamp01(flow.reciprocityBonus(), 0.0) : 0.0;
        }

        BehaviorProfile profileOf(String pid) {
            return profileByPid.getOrDefault(pid, BehaviorProfile.defaults(null));
        }

        String groupOf(String pid) {
            return groupByPid.get(pid);
        }

        // ── receiver choice ───────────────────────────────────────────────────

        String chooseReceiver(Random rng, String eq, String sender, BehaviorProfile profile) {
            List<String> reachable = reachable(eq, sender);
            if (reachable.isEmpty()) {
                reachable = scenario.paymentAdjacency(eq).getOrDefault(sender, List.of()).stream()
                    .filter(pid -> !pid.equals(sender))
                    .distinct()
                    .sorted()
                    .collect(Collectors.toList());
            }
            if (reachable.isEmpty()) return null;

            String viaFlow = pickByFlow(rng, sender, profile, reachable);
            if (viaFlow != null) return viaFlow;

            String targetGroup = pickGroup(rng, profile.recipientGroupWeights());
            if (targetGroup != null) {
                List<String> inGroup = membersOf(reachable, targetGroup);
                if (!inGroup.isEmpty()) return choice(rng, inGroup);
            }

            if (!allGroups.isEmpty()) {
                List<String> shuffled = new ArrayList<>(allGroups);
                Collections.shuffle(shuffled, rng);
                for (String g : shuffled) {
                    List<String> inGroup = membersOf(reachable, g);
                    if (!inGroup.isEmpty()) return choice(rng, inGroup);
                }
            }
            return choice(rng, reachable);
        }

        private String pickByFlow(Random rng, String sender, BehaviorProfile profile, List<String> reachable) {
            if (!flowEnabled) return null;
            String senderGroup = groupByPid.get(sender);
            List<List<String>> chains = profile.flowChains();
            if (senderGroup == null || chains == null || chains.isEmpty()) return null;

            double affinity = profile.flowAffinity() != null ? profile.flowAffinity() : flowDefaultAffinity;
            if (!(rng.nextDouble() < affinity)) return null;

            List<String> targets = chains.stream()
                .filter(chain -> chain != null && chain.size() >= 2 && senderGroup.equals(chain.get(0)))
                .map(chain -> chain.get(1))
                .collect(Collectors.toList());
            if (targets.isEmpty()) return null;

            String targetGroup = choice(rng, targets);
            List<String> inTarget = membersOf(reachable, targetGroup);
            return inTarget.isEmpty() ? null : choice(rng, inTarget);
        }

        private static String pickGroup(Random rng, Map<String, Double> weights) {
            if (weights == null || weights.isEmpty()) return null;
            List<Map.Entry<String, Double>> items = new TreeMap<>(weights).entrySet().stream()
                .filter(e -> !e.getKey().isBlank() && e.getValue() != null && e.getValue() > 0)
                .collect(Collectors.toList());
            if (items.isEmpty()) return null;
            double total = items.stream().mapToDouble(Map.Entry::getValue).sum();
            if (total <= 0) return null;
            double r = rng.nextDouble() * total;
            double acc = 0.0;
            for (Map.Entry<String, Double> item : items) {
                acc += item.getValue();
                if (r <= acc) return item.getKey();
            }
            return items.get(items.size() - 1).getKey();
        }

        /** Bounded BFS in payment direction; sorted, sender excluded. */
        private List<String> reachable(String eq, String sender) {
            Map<String, List<String>> graph = scenario.paymentAdjacency(eq);
            if (!graph.containsKey(sender)) return List.of();

            Set<String> visited = new LinkedHashSet<>();
            visited.add(sender);
            Deque<Map.Entry<String, Integer>> queue = new ArrayDeque<>();
            queue.add(Map.entry(sender, 0));
            outer:
            while (!queue.isEmpty() && visited.size() < REACH_MAX_NODES) {
                Map.Entry<String, Integer> head = queue.poll();
                if (head.getValue() >= REACH_MAX_DEPTH) continue;
                for (String next : graph.getOrDefault(head.getKey(), List.of())) {
                    if (!visited.add(next)) continue;
                    queue.add(Map.entry(next, head.getValue() + 1));
                    if (visited.size() >= REACH_MAX_NODES) break outer;
                }
            }
            visited.remove(sender);
            return new ArrayList<>(new TreeSet<>(visited));
        }

        private List<String> membersOf(List<String> reachable, String group) {
            Set<String> seen = new HashSet<>();
            return reachable.stream()
                .filter(pid -> group.equals(groupByPid.get(pid)) && seen.add(pid))
                .collect(Collectors.toList());
        }

        private static String choice(Random rng, List<String> items) {
            return items.get(rng.nextInt(items.size()));
        }

        // ── capacity ──────────────────────────────────────────────────────────

        BigDecimal usableLimit(Candidate c, String receiver) {
            String eq = c.equivalent();
            BigDecimal outRaw   = maxOutgoing.getOrDefault(nodeKey(c.sender(), eq), c.limit());
            BigDecimal inRaw    = maxIncoming.get(nodeKey(receiver, eq));
            BigDecimal direct   = directLimit.get(edgeKey(c.sender(), receiver, eq));

            BigDecimal limit = outRaw;
            if (inRaw != null && inRaw.signum() > 0)   limit = limit.min(inRaw);
            if (direct != null && direct.signum() > 0) limit = limit.min(direct);

            if (!snapshot.isEmpty()) {
                BigDecimal availableOut = outRaw.subtract(snapshot.outgoingTotal(c.sender(), eq)).max(BigDecimal.ZERO);
                limit = limit.min(availableOut);
                if (inRaw != null && inRaw.signum() > 0) {
                    BigDecimal availableIn = inRaw.subtract(snapshot.incomingTotal(receiver, eq)).max(BigDecimal.ZERO);
                    limit = limit.min(availableIn);
                }
                if (direct != null && direct.signum() > 0) {
                    BigDecimal availableDirect = direct.subtract(snapshot.amount(c.sender(), receiver, eq)).max(BigDecimal.ZERO);
                    limit = limit.min(availableDirect);
                }
                if (reciprocityBonus > 0 && snapshot.amount(receiver, c.sender(), eq).signum() > 0) {
                    limit = limit.multiply(BigDecimal.valueOf(1.0 + reciprocityBonus));
                }
            }
            return limit;
        }

        private static String edgeKey(String sender, String receiver, String eq) {
            return sender + "|" + receiver + "|" + eq;
        }

        private static String nodeKey(String pid, String eq) {
            return pid + "|" + eq;
        }

        private static boolean isBlank(String s) {
            return s == null || s.isBlank();
        }
    }
}
