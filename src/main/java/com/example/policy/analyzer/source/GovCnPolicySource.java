package com.example.policy.analyzer.source;

import com.example.policy.analyzer.entity.PolicyEvent;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * State Council "latest policies" listing on www.gov.cn.
 */
@Component
public class GovCnPolicySource extends AbstractHtmlPolicySource {

    private static final String PAGE_URL = "https://www.gov.cn/zhengce/zuixin/home_%d.htm";

    public GovCnPolicySource(Clock clock) {
        super(clock);
    }

    @Override
    public String getSourceName() {
        return "gov_cn";
    }

    @Override
    public String pageUrl(int pageIndex) {
        return String.format(PAGE_URL, pageIndex);
    }

    @Override
    protected PolicyEvent buildEvent(LocalDate date, String title, String url) {
        PolicyEvent event = newEvent(date, title, url);
        event.setEventType(PolicyAttributeClassifier.classifyPolicyType(title));
        event.setDepartment(PolicyAttributeClassifier.extractDepartment(title, url));
        event.setPolicyLevel(PolicyAttributeClassifier.determinePolicyLevel(title));
        return event;
    }
}
