/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.archivist.domain.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single-linkage grouping over a symmetric similarity matrix.
 *
 * <p>
 * Two items end up in one group when a chain of pairs at or above the
 * threshold connects them. The reported confidence of a group is the minimum
 * similarity over all of its pairs, not the threshold that linked it, so a
 * group held together by a chain shows its weakest pair.
 */
@Component
public class SimilarityClusterer {

    /**
     * @param members
     *            item indexes in ascending order
     * @param minSimilarity
     *            minimum pairwise similarity among the members
     */
    public record Cluster(List<Integer> members, double minSimilarity) {
    }

    /**
     * Groups of two or more items, in order of their smallest member.
     */
    public List<Cluster> cluster(double[][] similarity, double threshold) {
        int size = similarity.length;
        int[] parent = new int[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }
        for (int i = 0; i < size; i++) {
            for (int j = i + 1; j < size; j++) {
                if (similarity[i][j] >= threshold) {
                    union(parent, i, j);
                }
            }
        }

        Map<Integer, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < size; i++) {
            groups.computeIfAbsent(find(parent, i), root -> new ArrayList<>()).add(i);
        }

        List<Cluster> clusters = new ArrayList<>();
        for (List<Integer> members : groups.values()) {
            if (members.size() < 2) {
                continue;
            }
            clusters.add(new Cluster(List.copyOf(members), minPairwise(similarity, members)));
        }
        return clusters;
    }

    static double minPairwise(double[][] similarity, List<Integer> members) {
        double min = Double.MAX_VALUE;
        for (int a = 0; a < members.size(); a++) {
            for (int b = a + 1; b < members.size(); b++) {
                min = Math.min(min, similarity[members.get(a)][members.get(b)]);
            }
        }
        return min == Double.MAX_VALUE ? 0.0 : min;
    }

    private static int find(int[] parent, int item) {
        int root = item;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[item] != root) {
            int next = parent[item];
            parent[item] = root;
            item = next;
        }
        return root;
    }

    private static void union(int[] parent, int first, int second) {
        int rootFirst = find(parent, first);
        int rootSecond = find(parent, second);
        if (rootFirst != rootSecond) {
            parent[Math.max(rootFirst, rootSecond)] = Math.min(rootFirst, rootSecond);
        }
    }
}
