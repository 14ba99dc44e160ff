package com.example.policy.analyzer.source;

import com.example.policy.analyzer.entity.PolicyEvent;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Ministry of Finance policy releases. The listing mixes in news and procurement notices, so
 * only policy-like items are kept.
 */
@Component
public class MofPolicySource extends AbstractHtmlPolicySource {

    private static final String BASE_URL = "https://www.mof.gov.cn/zhengwuxinxi/zhengcefabu/";

    public MofPolicySource(Clock clock) {
        super(clock);
    }

    @Override
    public String getSourceName() {
        return "mof";
    }

    @Override
    public String pageUrl(int pageIndex) {
        return pageIndex == 0 ? BASE_URL + "index.htm" : BASE_URL + "index_" + pageIndex + ".htm";
    }

    @Override
    protected boolean acceptCandidate(String title, String url) {
        return PolicyAttributeClassifier.isMofPolicyContent(title, url);
    }

    @Override
    protected PolicyEvent buildEvent(LocalDate date, String title, String url) {
        PolicyEvent event = newEvent(date, title, url);
        event.setEventType("财政政策");
        event.setDepartment("财政部");
        event.setPolicyLevel("国家级");
        return event;
    }
}
