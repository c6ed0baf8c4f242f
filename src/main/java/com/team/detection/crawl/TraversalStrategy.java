package com.team.detection.crawl;

import java.util.Deque;
import java.util.List;
import java.util.ListIterator;

/**
 * Order in which the crawl worklist is processed. The worklist is always polled from the head;
 * strategies differ only in where newly discovered visits are placed.
 */
public enum TraversalStrategy {

    /** Stack discipline: the first candidate of a profile is fully explored before its siblings. */
    DEPTH_FIRST {
        @Override
        void schedule(Deque<PendingVisit> worklist, List<PendingVisit> visits) {
            ListIterator<PendingVisit> it = visits.listIterator(visits.size());
            while (it.hasPrevious()) {
                worklist.addFirst(it.previous());
            }
        }
    },

    /** Queue discipline: all profiles of one depth level are visited before the next level. */
    BREADTH_FIRST {
        @Override
        void schedule(Deque<PendingVisit> worklist, List<PendingVisit> visits) {
            visits.forEach(worklist::addLast);
        }
    };

    /**
     * Adds visits to the worklist so that they are polled in their list order relative to each other.
     */
    abstract void schedule(Deque<PendingVisit> worklist, List<PendingVisit> visits);
}
