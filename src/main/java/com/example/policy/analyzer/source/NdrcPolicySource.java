package com.example.policy.analyzer.source;

import com.example.policy.analyzer.entity.PolicyEvent;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * NDRC orders ("发展改革委令") listing.
 */
@Component
public class NdrcPolicySource extends AbstractHtmlPolicySource {

    private static final String BASE_URL = "https://www.ndrc.gov.cn/xxgk/zcfb/fzggwl/";

    public NdrcPolicySource(Clock clock) {
        super(clock);
    }

    @Override
    public String getSourceName() {
        return "ndrc";
    }

    @Override
    public String pageUrl(int pageIndex) {
        return pageIndex == 0 ? BASE_URL + "index.html" : BASE_URL + "index_" + pageIndex + ".html";
    }

    @Override
    protected PolicyEvent buildEvent(LocalDate date, String title, String url) {
        PolicyEvent event = newEvent(date, title, url);
        event.setEventType("发改委政策");
        event.setDepartment("国家发改委");
        event.setPolicyLevel("国家级");
        return event;
    }
}
