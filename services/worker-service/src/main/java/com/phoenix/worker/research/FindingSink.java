package com.phoenix.worker.research;

import com.phoenix.worker.domain.ResearchFinding;
import java.util.Collection;

/**
 * Receives the current finding set after every funnel stage, so findings survive a later failure.
 */
@FunctionalInterface
public interface FindingSink {

    void publish(Collection<ResearchFinding> findings);
}
