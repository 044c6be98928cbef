/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.service.analysis;

import it.unimi.dsi.fastutil.objects.Object2ByteOpenHashMap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds cycles in a directed graph of rule paths with an iterative three-color DFS.
 *
 * <p>Iterative so that long inheritance chains cannot overflow the stack. Each cycle is
 * reported once, rotated so it starts at its lexicographically smallest path, without
 * repeating the first path at the end. Nodes are visited in sorted order, which makes
 * the output deterministic.
 */
public final class CycleFinder {

    private static final byte WHITE = 0;
    private static final byte GRAY = 1;
    private static final byte BLACK = 2;

    private CycleFinder() {
    }

    /**
     * @param edges node to successors; successors that are not keys are ignored
     * @return distinct cycles in discovery order
     */
    public static List<List<String>> findCycles(Map<String, List<String>> edges) {
        Object2ByteOpenHashMap<String> color = new Object2ByteOpenHashMap<>(edges.size());
        color.defaultReturnValue(WHITE);
        Set<List<String>> cycles = new LinkedHashSet<>();

        for (String start : new TreeSet<>(edges.keySet())) {
            if (color.getByte(start) != WHITE) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            push(start, edges, stack, path, color);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.next < frame.successors.size()) {
                    String successor = frame.successors.get(frame.next++);
                    if (!edges.containsKey(successor)) {
                        continue;
                    }
                    byte state = color.getByte(successor);
                    if (state == GRAY) {
                        cycles.add(canonical(path.subList(path.indexOf(successor), path.size())));
                    } else if (state == WHITE) {
                        push(successor, edges, stack, path, color);
                    }
                } else {
                    color.put(frame.node, BLACK);
                    stack.pop();
                    path.remove(path.size() - 1);
                }
            }
        }
        return new ArrayList<>(cycles);
    }

    /**
     * {@code [a, b, c]} becomes {@code "a -> b -> c -> a"}.
     */
    public static String describe(List<String> cycle) {
        return String.join(" -> ", cycle) + " -> " + cycle.get(0);
    }

    private static void push(String node, Map<String, List<String>> edges, Deque<Frame> stack,
                             List<String> path, Object2ByteOpenHashMap<String> color) {
        color.put(node, GRAY);
        path.add(node);
        stack.push(new Frame(node, edges.getOrDefault(node, List.of())));
    }

    private static List<String> canonical(List<String> cycle) {
        int smallest = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i).compareTo(cycle.get(smallest)) < 0) {
                smallest = i;
            }
        }
        List<String> rotated = new ArrayList<>(cycle);
        Collections.rotate(rotated, -smallest);
        return List.copyOf(rotated);
    }

    private static final class Frame {
        final String node;
        final List<String> successors;
        int next;

        Frame(String node, List<String> successors) {
            this.node = node;
            this.successors = successors;
        }
    }
}
