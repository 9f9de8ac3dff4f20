package org.nowstart.grammar.scheduler;

import lombok.RequiredArgsConstructor;
import org.nowstart.grammar.service.BarDecisionService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class FeedWatchdogScheduler {

    private final BarDecisionService barDecisionService;

    @Scheduled(fixedDelayString = "${grammar.watchdog.interval:30s}")
    public void run() {
        barDecisionService.markStaleFeeds();
    }
}
