package com.gdin.inspection.cognify.index.pipeline;

import com.gdin.inspection.cognify.exception.FatalPipelineException;
import lombok.Getter;
import lombok.Value;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 任务 DAG。迭代顺序是拓扑序，入度相同的任务按声明顺序排列。
 */
public class Pipeline<C> implements Iterable<Pipeline.Step<C>> {

    @Value
    public static class Step<C> {
        String name;
        List<String> upstreams;
        WorkflowFunction<C> fn;
    }

    @Getter
    private final String name;

    private final Map<String, Step<C>> steps = new LinkedHashMap<>();

    public Pipeline(String name) {
        this.name = name;
    }

    public Pipeline<C> add(String name, List<String> upstreams, WorkflowFunction<C> fn) {
        if (steps.containsKey(name)) {
            throw new FatalPipelineException("任务重复: " + name + ", pipeline=" + this.name);
        }
        steps.put(name, new Step<>(name, List.copyOf(upstreams), fn));
        return this;
    }

    public void remove(String name) {
        steps.remove(name);
    }

    public int size() {
        return steps.size();
    }

    /**
     * @throws FatalPipelineException 上游任务未声明或存在依赖环
     */
    public List<Step<C>> ordered() {
        for (Step<C> s : steps.values()) {
            for (String up : s.getUpstreams()) {
                if (!steps.containsKey(up)) {
                    throw new FatalPipelineException("任务 " + s.getName() + " 依赖的上游任务不存在: " + up);
                }
            }
        }

        List<Step<C>> out = new ArrayList<>(steps.size());
        Set<String> done = new LinkedHashSet<>();
        while (out.size() < steps.size()) {
            Step<C> next = null;
            for (Step<C> s : steps.values()) {
                if (!done.contains(s.getName()) && done.containsAll(s.getUpstreams())) {
                    next = s;
                    break;
                }
            }
            if (next == null) {
                List<String> rest = new ArrayList<>(steps.keySet());
                rest.removeAll(done);
                throw new FatalPipelineException("pipeline " + name + " 存在依赖环: " + rest);
            }
            done.add(next.getName());
            out.add(next);
        }
        return out;
    }

    /**
     * 直接或间接依赖 task 的所有任务。
     */
    public Set<String> downstreamOf(String task) {
        Set<String> out = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(task);
        while (!queue.isEmpty()) {
            String cur = queue.poll();
            for (Step<C> s : steps.values()) {
                if (s.getUpstreams().contains(cur) && out.add(s.getName())) {
                    queue.add(s.getName());
                }
            }
        }
        return out;
    }

    @Override
    public Iterator<Step<C>> iterator() {
        return ordered().iterator();
    }
}
