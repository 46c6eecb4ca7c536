package com.taskforest.core.validation;

import com.taskforest.core.model.TaskSkeleton;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable parent-pointer view of a task set, used to answer cycle questions while
 * edges are being validated and assigned.
 * <p>
 * Task ids map to dense indices and parent pointers live in an {@code int[]}. Every
 * walk is a loop over that array, so arbitrarily deep chains never touch the call stack.
 * Tasks added as {@code external} belong to other partitions: their parent pointers are
 * followed by every walk, but a pass only ever changes the pointers of its own members.
 */
public class ParentGraph {

    private static final int NONE = -1;

    private final Map<String, Integer> indexOf;
    private final TaskSkeleton[] skeletons;
    private final int[] parent;

    private ParentGraph(List<TaskSkeleton> members, List<TaskSkeleton> externals) {
        int n = members.size() + externals.size();
        this.indexOf = new HashMap<>(n * 2);
        this.skeletons = new TaskSkeleton[n];
        this.parent = new int[n];
        Arrays.fill(parent, NONE);

        int i = 0;
        for (TaskSkeleton s : members) {
            if (indexOf.putIfAbsent(s.taskId(), i) == null) {
                skeletons[i++] = s;
            }
        }
        for (TaskSkeleton s : externals) {
            if (indexOf.putIfAbsent(s.taskId(), i) == null) {
                skeletons[i++] = s;
            }
        }
        for (int j = 0; j < i; j++) {
            if (skeletons[j].hasParent()) {
                parent[j] = indexOf.getOrDefault(skeletons[j].parentTaskId(), NONE);
            }
        }
    }

    public static ParentGraph of(Collection<TaskSkeleton> members) {
        return new ParentGraph(List.copyOf(members), List.of());
    }

    /**
     * @param members   tasks whose parent pointers are tracked and may change
     * @param externals tasks outside the pass that members may reach through parent ids
     */
    public static ParentGraph of(Collection<TaskSkeleton> members, Collection<TaskSkeleton> externals) {
        return new ParentGraph(List.copyOf(members), List.copyOf(externals));
    }

    public boolean contains(String taskId) {
        return taskId != null && indexOf.containsKey(taskId);
    }

    public Optional<TaskSkeleton> skeleton(String taskId) {
        Integer i = taskId == null ? null : indexOf.get(taskId);
        return i == null ? Optional.empty() : Optional.of(skeletons[i]);
    }

    public Optional<String> parentOf(String taskId) {
        Integer i = indexOf.get(taskId);
        if (i == null || parent[i] == NONE) {
            return Optional.empty();
        }
        return Optional.of(skeletons[parent[i]].taskId());
    }

    public void setParent(String childId, String parentId) {
        int child = require(childId);
        parent[child] = require(parentId);
    }

    public void clearParent(String childId) {
        Integer i = indexOf.get(childId);
        if (i != null) {
            parent[i] = NONE;
        }
    }

    /**
     * Whether pointing {@code childId} at {@code parentId} would close a loop, i.e. the
     * child is already among the candidate's ancestors.
     */
    public boolean wouldCreateCycle(String childId, String parentId) {
        Integer child = indexOf.get(childId);
        Integer start = indexOf.get(parentId);
        if (child == null || start == null) {
            return false;
        }
        int current = start;
        int steps = 0;
        while (current != NONE && steps <= parent.length) {
            if (current == child) {
                return true;
            }
            current = parent[current];
            steps++;
        }
        return false;
    }

    /** Ancestors of {@code taskId}, nearest first. Stops if the chain loops. */
    public List<String> ancestorsOf(String taskId) {
        var out = new ArrayList<String>();
        Integer start = indexOf.get(taskId);
        if (start == null) {
            return out;
        }
        boolean[] seen = new boolean[parent.length];
        seen[start] = true;
        int current = parent[start];
        while (current != NONE && !seen[current]) {
            seen[current] = true;
            out.add(skeletons[current].taskId());
            current = parent[current];
        }
        return out;
    }

    public boolean isAcyclic() {
        return findCycles().isEmpty();
    }

    /** Every task that sits on a parent loop. */
    public List<String> findCycleMembers() {
        var out = new ArrayList<String>();
        findCycles().forEach(out::addAll);
        return out;
    }

    /**
     * Each parent loop as a list of task ids, in walk order.
     */
    public List<List<String>> findCycles() {
        // 0 = unvisited, 1 = on the current walk, 2 = done
        byte[] state = new byte[parent.length];
        var cycles = new ArrayList<List<String>>();
        Deque<Integer> path = new ArrayDeque<>();
        for (int start = 0; start < parent.length; start++) {
            if (state[start] != 0 || skeletons[start] == null) {
                continue;
            }
            int current = start;
            while (current != NONE && state[current] == 0) {
                state[current] = 1;
                path.addLast(current);
                current = parent[current];
            }
            if (current != NONE && state[current] == 1) {
                var cycle = new ArrayList<String>();
                boolean inCycle = false;
                for (int node : path) {
                    if (node == current) {
                        inCycle = true;
                    }
                    if (inCycle) {
                        cycle.add(skeletons[node].taskId());
                    }
                }
                cycles.add(cycle);
            }
            while (!path.isEmpty()) {
                state[path.removeLast()] = 2;
            }
        }
        return cycles;
    }

    public int size() {
        return indexOf.size();
    }

    private int require(String taskId) {
        Integer i = taskId == null ? null : indexOf.get(taskId);
        if (i == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return i;
    }
}
