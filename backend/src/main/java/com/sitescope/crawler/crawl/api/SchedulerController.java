package com.sitescope.crawler.crawl.api;

import com.sitescope.crawler.crawl.model.SchedulerStatusResponse;
import com.sitescope.crawler.crawl.service.CrawlSchedulerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {
    private final CrawlSchedulerService schedulerService;

    public SchedulerController(CrawlSchedulerService schedulerService) {
        this.schedulerService = schedulerService;
    }

    @GetMapping
    public SchedulerStatusResponse status() {
        return schedulerService.getStatus();
    }

    @PostMapping("/start")
    public SchedulerStatusResponse start() {
        schedulerService.start();
        return schedulerService.getStatus();
    }

    @PostMapping("/stop")
    public SchedulerStatusResponse stop() {
        schedulerService.stop();
        return schedulerService.getStatus();
    }

    @PostMapping("/poll")
    public SchedulerStatusResponse poll() {
        schedulerService.pollNow();
        return schedulerService.getStatus();
    }
}
