package com.viffx.Fsm.Compiler;

import com.viffx.Fsm.Grammar.Grammar;
import com.viffx.Fsm.Grammar.Production;
import com.viffx.Fsm.Logging;
import org.apache.log4j.Logger;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Builds LALR(1) ACTION/GOTO rows for a {@link Grammar}.
 * <p>
 * The LR(0) automaton is built first. Lookaheads are then discovered per kernel item by
 * taking the LR(1) closure of the item with the placeholder lookahead {@code TEST}: real
 * terminals found in the closure are generated spontaneously, {@code TEST} marks a lookahead
 * that is propagated from the kernel item. Propagation runs until nothing changes.
 */
public class LALR1ParseTableGenerator {
    private static final Logger LOG = Logging.getLogger();

    //[INSTANCE_FIELDS]
    private final Grammar grammar;
    private final HashMap<Integer, Set<Integer>> firstSets;
    private final Set<Integer> nullable;

    //[CONSTRUCTORS]
    public LALR1ParseTableGenerator(Grammar grammar) {
        this.grammar = grammar;

        HashMap<Integer, Set<Integer>> firstSets = new HashMap<>(grammar.symbolCount());
        Set<Integer> nullable = new HashSet<>();
        final int productionsCount = grammar.productionsCount();
        grammar.forEachNonTerminal(nonTerminal -> firstSets.put(nonTerminal, new HashSet<>()));

        // A non-terminal is nullable once one of its productions consists of nullable symbols only.
        // Its first set collects the terminals that can start any of its productions.
        boolean change;
        do {
            change = false;
            for (int i = 0; i < productionsCount; i++) {
                Production production = grammar.production(i);
                Set<Integer> firstSet = firstSets.get(production.lhs());
                boolean allNullable = true;
                for (int symbol : production) {
                    if (!grammar.isNonTerminal(symbol)) {
                        change |= firstSet.add(symbol);
                        allNullable = false;
                        break;
                    }
                    change |= firstSet.addAll(firstSets.get(symbol));
                    if (!nullable.contains(symbol)) {
                        allNullable = false;
                        break;
                    }
                }
                if (allNullable) change |= nullable.add(production.lhs());
            }
        } while (change);

        if (LOG.isTraceEnabled()) {
            LOG.trace("First sets:\n" + firstSets
                    .keySet()
                    .stream()
                    .map(
                            key -> grammar.symbol(key) + (nullable.contains(key) ? "?" : "") + " => " +
                                    firstSets.get(key)
                                            .stream()
                                            .map(grammar::symbol)
                                            .toList()
                    ).collect(Collectors.joining("\n")));
        }

        this.firstSets = firstSets;
        this.nullable = nullable;
    }

    //[INTERNAL_DATATYPES]
    private record SignedItem(int state, Item item) {
        private SignedItem {
            if (state < 0) throw new IllegalArgumentException("States must be positive");
        }

        public String toReadable(Grammar g) {
            return "I" + state + ": " + g.toString(item);
        }
    }

    //[PRIVATE_METHODS]

    // FIRST of a symbol string, containing EPSILON when the whole string is nullable
    private Set<Integer> first(List<Integer> symbols) {
        Set<Integer> terminals = new HashSet<>();
        for (int symbol : symbols) {
            if (!grammar.isNonTerminal(symbol)) {
                terminals.add(symbol);
                return terminals;
            }
            terminals.addAll(firstSets.get(symbol));
            if (!nullable.contains(symbol)) return terminals;
        }
        terminals.add(grammar.EPSILON());
        return terminals;
    }

    // LR(0) closure of a kernel
    private Set<Item> closure0(Set<Item> kernel) {
        Set<Item> J = new LinkedHashSet<>(kernel);
        Queue<Item> queue = new LinkedList<>(kernel);
        while (!queue.isEmpty()) {
            Item item = queue.poll();
            if (grammar.atEnd(item)) continue;

            int B = grammar.symbol(item);
            if (!grammar.isNonTerminal(B)) continue;
            grammar.forEachProduction(B, index -> {
                Item newItem = new Item(index, 0, null);
                if (J.add(newItem)) queue.add(newItem);
            });
        }
        return J;
    }

    // LR(1) closure
    private Set<Item> closure(Set<Item> I) {
        Set<Item> J = new LinkedHashSet<>(I);
        Queue<Item> queue = new LinkedList<>(I);
        while (!queue.isEmpty()) {
            Item item = queue.poll();

            if (grammar.atEnd(item)) continue;

            int B = grammar.symbol(item);
            if (!grammar.isNonTerminal(B)) continue;

            // FIRST(βa) where β follows B and a is the lookahead of the item
            Set<Integer> firstBeta = first(grammar.beta(item));
            Set<Integer> firstBetaA = new LinkedHashSet<>();
            for (int t : firstBeta) {
                if (t != grammar.EPSILON()) firstBetaA.add(t);
            }
            if (firstBeta.contains(grammar.EPSILON())) {
                firstBetaA.add(item.lookahead());
            }

            grammar.forEachProduction(B, index -> {
                for (int t : firstBetaA) {
                    Item newItem = new Item(index, 0, t);
                    if (J.add(newItem)) queue.add(newItem);
                }
            });
        }
        return J;
    }

    //[PUBLIC_METHODS]

    /**
     * Generates the parse table.
     *
     * @return one row per state, mapping symbol indices to actions; terminals map to SHIFT,
     * REDUCE or ACCEPT and non-terminals to GOTO
     * @throws IllegalStateException if the grammar is not LALR(1)
     */
    public List<Map<Integer, Action>> generate() {
        HashMap<SignedItem, Set<Integer>> spontaneous = new HashMap<>();
        HashMap<SignedItem, Set<SignedItem>> propagated = new HashMap<>();
        List<int[]> transitions = new ArrayList<>();
        Map<Integer, Map<Item, Set<Integer>>> lookaheads;

        processStates(spontaneous, propagated, transitions);
        lookaheads = initLookaheadTable(spontaneous);
        propagateLookaheads(lookaheads, propagated);

        List<Map<Integer, Action>> actions = calculateParseTable(lookaheads, transitions);

        if (LOG.isTraceEnabled()) {
            printChannels(spontaneous, propagated);
            printLookaheads(lookaheads);
            printTransitions(transitions);
            printActions(actions);
        }
        LOG.debug("Generated " + actions.size() + " LALR(1) states for " + grammar.productionsCount()
                + " productions of " + grammar.name());
        return actions;
    }

    //[HELPER_METHODS_FOR_GENERATE]
    private void processStates(HashMap<SignedItem, Set<Integer>> spontaneous, HashMap<SignedItem, Set<SignedItem>> propagated, List<int[]> transitions) {
        // 1. Define the start item
        Item startItem = new Item(grammar.startProduction(), 0, null);

        // 2. State machine bookkeeping
        Map<Set<Item>, Integer> stateToId = new HashMap<>();
        List<Set<Item>> kernels = new ArrayList<>();
        Set<Item> start = Set.of(startItem);
        stateToId.put(start, 0);
        kernels.add(start);

        spontaneous.computeIfAbsent(new SignedItem(0, startItem), ignored -> new HashSet<>()).add(grammar.EOF());

        // kernels grows while it is walked, every new kernel is visited once
        for (int fromState = 0; fromState < kernels.size(); fromState++) {
            Set<Item> state = kernels.get(fromState);
            int[] transitionTable = new int[grammar.symbolCount()];
            Arrays.fill(transitionTable, -1);

            expandItems(state, stateToId, kernels, transitionTable);
            transitions.add(transitionTable);
            calculateLookaheadData(spontaneous, propagated, state, transitionTable, fromState);
        }
    }

    private void expandItems(Set<Item> state, Map<Set<Item>, Integer> stateToId, List<Set<Item>> kernels, int[] transitionTable) {
        // group the advanced items by the symbol the dot moves over, ordered by symbol for stable state numbers
        TreeMap<Integer, Set<Item>> allGotos = new TreeMap<>();
        for (Item item : closure0(state)) {
            if (grammar.atEnd(item)) continue;
            int gotoSymbol = grammar.symbol(item);
            allGotos.computeIfAbsent(gotoSymbol, ignored -> new LinkedHashSet<>()).add(item.advance());
        }

        buildStates(stateToId, kernels, transitionTable, allGotos);
    }

    private void buildStates(Map<Set<Item>, Integer> stateToId, List<Set<Item>> kernels, int[] transitionTable, Map<Integer, Set<Item>> gotos) {
        for (Map.Entry<Integer, Set<Item>> entry : gotos.entrySet()) {
            Set<Item> newState = entry.getValue();
            Integer id = stateToId.get(newState);
            if (id == null) {
                id = kernels.size();
                stateToId.put(newState, id);
                kernels.add(newState);
            }
            transitionTable[entry.getKey()] = id;
        }
    }

    private void calculateLookaheadData(HashMap<SignedItem, Set<Integer>> spontaneous, HashMap<SignedItem, Set<SignedItem>> propagated, Set<Item> state, int[] transitionTable, int fromState) {
        for (Item item : state) {
            // Seed an LR(1) item with a placeholder TEST lookahead
            Set<Item> closure = closure(Set.of(item.withLookahead(grammar.TEST())));

            for (Item B : closure) {
                int lookahead = B.lookahead();
                Item core = B.core();

                if (grammar.atEnd(B)) {
                    // Completed items in a closure are either the kernel item itself or empty productions,
                    // the latter reduce in this very state.
                    if (core.equals(item)) continue;
                    if (lookahead == grammar.TEST()) {
                        propagated.computeIfAbsent(new SignedItem(fromState, item), ignored -> new HashSet<>())
                                .add(new SignedItem(fromState, core));
                    } else {
                        spontaneous.computeIfAbsent(new SignedItem(fromState, core), ignored -> new HashSet<>())
                                .add(lookahead);
                    }
                    continue;
                }

                int toState = transitionTable[grammar.symbol(B)];
                if (toState < 0) throw new IllegalStateException("Missing transition for " + grammar.toString(B));
                SignedItem target = new SignedItem(toState, B.advance().core());

                if (lookahead == grammar.TEST()) {
                    // from (state,item) → to (state,item)
                    propagated.computeIfAbsent(new SignedItem(fromState, item), ignored -> new HashSet<>())
                            .add(target);
                } else {
                    spontaneous.computeIfAbsent(target, ignored -> new HashSet<>()).add(lookahead);
                }
            }
        }
    }

    private static Map<Integer, Map<Item, Set<Integer>>> initLookaheadTable(HashMap<SignedItem, Set<Integer>> spontaneous) {
        Map<Integer, Map<Item, Set<Integer>>> lookaheads = new HashMap<>();
        spontaneous.forEach((signedItem, terminals) -> lookaheads
                .computeIfAbsent(signedItem.state, ignored -> new HashMap<>())
                .computeIfAbsent(signedItem.item, ignored -> new HashSet<>())
                .addAll(terminals));
        return lookaheads;
    }

    private void propagateLookaheads(Map<Integer, Map<Item, Set<Integer>>> lookaheads, Map<SignedItem, Set<SignedItem>> propagated) {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (var entry : propagated.entrySet()) {
                SignedItem from = entry.getKey();
                Set<Integer> terminals = lookaheads
                        .getOrDefault(from.state, Map.of())
                        .getOrDefault(from.item, Set.of());
                if (terminals.isEmpty()) continue;

                for (SignedItem to : entry.getValue()) {
                    changed |= lookaheads
                            .computeIfAbsent(to.state, ignored -> new HashMap<>())
                            .computeIfAbsent(to.item, ignored -> new HashSet<>())
                            .addAll(terminals);
                }
            }
        }
    }

    private List<Map<Integer, Action>> calculateParseTable(Map<Integer, Map<Item, Set<Integer>>> lookaheads, List<int[]> transitions) {
        List<Map<Integer, Action>> ACTIONS = new ArrayList<>(transitions.size());
        for (int state = 0; state < transitions.size(); state++) {
            Map<Integer, Action> actions = new HashMap<>();

            // transitions[fromState][transitionSymbol] = toState
            int[] transitionTable = transitions.get(state);
            for (int symbol = 0; symbol < transitionTable.length; symbol++) {
                int target = transitionTable[symbol];
                if (target < 0) continue;
                actions.put(symbol, new Action(grammar.isNonTerminal(symbol) ? ActionType.GOTO : ActionType.SHIFT, target));
            }

            Map<Item, Set<Integer>> lookahead = lookaheads.getOrDefault(state, Map.of());
            for (Map.Entry<Item, Set<Integer>> entry : lookahead.entrySet()) {
                Item item = entry.getKey();
                if (!grammar.atEnd(item)) continue;
                Action action = item.index() == grammar.startProduction()
                        ? new Action(ActionType.ACCEPT, item.index())
                        : new Action(ActionType.REDUCE, item.index());
                for (int symbol : entry.getValue()) {
                    Action existing = actions.putIfAbsent(symbol, action);
                    if (existing != null && !existing.equals(action)) {
                        throw new IllegalStateException(conflict(state, symbol, existing, action));
                    }
                }
            }
            ACTIONS.add(actions);
        }
        return ACTIONS;
    }

    private String conflict(int state, int symbol, Action first, Action second) {
        String kind = first.type() == ActionType.SHIFT || second.type() == ActionType.SHIFT ? "shift/reduce" : "reduce/reduce";
        return grammar.name() + " is not LALR(1): " + kind + " conflict in state " + state
                + " on " + grammar.symbol(symbol) + " between " + describe(first) + " and " + describe(second);
    }

    private String describe(Action action) {
        return switch (action.type()) {
            case REDUCE, ACCEPT -> action.type() + " " + grammar.toString(grammar.production(action.data()));
            default -> action.toString();
        };
    }

    private void printChannels(HashMap<SignedItem, Set<Integer>> spontaneous, HashMap<SignedItem, Set<SignedItem>> propagated) {
        StringBuilder text = new StringBuilder("Channels:\n\tSpontaneous\n");
        spontaneous.forEach((key, values) -> {
            String front = key.toReadable(grammar);
            front += " ".repeat(Math.max(0, 20 - front.length()));
            text.append("\t\t").append(front).append(" ==> ")
                    .append(values.stream().map(item -> grammar.symbol(item).toString()).collect(Collectors.joining(", ", "[", "]")))
                    .append('\n');
        });
        text.append("\tPropagated\n");
        propagated.forEach((key, values) -> values.forEach(value -> {
            String front = key.toReadable(grammar);
            front += " ".repeat(Math.max(0, 20 - front.length()));
            text.append("\t\t").append(front).append(" ==> ").append(value.toReadable(grammar)).append('\n');
        }));
        LOG.trace(text);
    }

    private void printLookaheads(Map<Integer, Map<Item, Set<Integer>>> lookaheads) {
        StringBuilder text = new StringBuilder();
        lookaheads.forEach((state, lookahead) -> lookahead.forEach((key, terminals) -> {
            String item = grammar.toString(key);
            text.append("State: ").append(state).append(" Item: ").append(item)
                    .append(" ".repeat(Math.max(0, 17 - item.length())))
                    .append("Lookaheads: ").append(terminals.stream().map(grammar::symbol).toList())
                    .append('\n');
        }));
        LOG.trace(text);
    }

    private void printTransitions(List<int[]> transitions) {
        StringBuilder text = new StringBuilder();
        for (int state = 0; state < transitions.size(); state++) {
            int[] transitionTable = transitions.get(state);
            for (int i = 0; i < transitionTable.length; i++) {
                if (transitionTable[i] >= 0) {
                    text.append("State ")
                            .append(state)
                            .append(":")
                            .append(" on ")
                            .append(grammar.symbol(i))
                            .append(" goto ")
                            .append(transitionTable[i])
                            .append("\n");
                }
            }
        }
        LOG.trace(text);
    }

    private void printActions(List<Map<Integer, Action>> ACTIONS) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < ACTIONS.size(); i++) {
            Map<Integer, Action> actions = ACTIONS.get(i);
            text.append(i).append(" ")
                    .append(actions.keySet().stream().map(key -> '"' + grammar.symbol(key).toString() + "\" ==> " + actions.get(key)).toList())
                    .append('\n');
        }
        LOG.trace(text);
    }
}
