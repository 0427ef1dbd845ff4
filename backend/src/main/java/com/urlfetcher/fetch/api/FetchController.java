package com.urlfetcher.fetch.api;

import com.urlfetcher.fetch.model.FetchJob;
import com.urlfetcher.fetch.model.UrlResponse;
import com.urlfetcher.fetch.service.JobNotFoundException;
import com.urlfetcher.fetch.service.ResponseNotCachedException;
import com.urlfetcher.fetch.service.UrlFetchService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class FetchController {
    private final UrlFetchService fetchService;

    public FetchController(UrlFetchService fetchService) {
        this.fetchService = fetchService;
    }

    @PostMapping("/jobs")
    public FetchJob addJob(
        @RequestBody(required = false) AddJobRequest request,
        @RequestParam(name = "url", required = false) String url
    ) {
        String target = request != null && request.url() != null ? request.url() : url;
        return fetchService.submit(target);
    }

    @GetMapping("/jobs")
    public List<FetchJob> listJobs() {
        return fetchService.listJobs();
    }

    @GetMapping("/jobs/{id}")
    public FetchJob getJob(@PathVariable("id") long id) {
        return fetchService.getJob(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    @GetMapping("/responses")
    public List<UrlResponse> listResponses() {
        return fetchService.listResponses();
    }

    @GetMapping("/response")
    public UrlResponse getResponse(@RequestParam(name = "url") String url) {
        return fetchService.getResponse(url).orElseThrow(() -> new ResponseNotCachedException(url));
    }
}
