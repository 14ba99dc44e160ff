package com.example.policy.analyzer.source;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword heuristics for the descriptive columns of a policy record.
 */
public final class PolicyAttributeClassifier {

    private static final Map<String, List<String>> POLICY_TYPES = new LinkedHashMap<>();
    private static final Map<String, List<String>> DEPARTMENTS = new LinkedHashMap<>();
    private static final Map<String, List<String>> CSRC_TYPES = new LinkedHashMap<>();

    static {
        POLICY_TYPES.put("货币政策", List.of("货币", "央行", "利率", "准备金", "流动性"));
        POLICY_TYPES.put("财政政策", List.of("财政", "税收", "减税", "财政部", "预算"));
        POLICY_TYPES.put("房地产政策", List.of("房地产", "楼市", "住房", "房价"));
        POLICY_TYPES.put("证券政策", List.of("股市", "证券", "上市", "IPO", "证监会"));
        POLICY_TYPES.put("经济政策", List.of("经济", "发展", "改革", "开放"));
        POLICY_TYPES.put("环保政策", List.of("环保", "环境", "碳", "绿色"));
        POLICY_TYPES.put("科技政策", List.of("科技", "创新", "研发", "技术"));

        DEPARTMENTS.put("国务院", List.of("国务院", "guowuyuan"));
        DEPARTMENTS.put("央行", List.of("央行", "人民银行", "pbc"));
        DEPARTMENTS.put("财政部", List.of("财政部", "mof"));
        DEPARTMENTS.put("发改委", List.of("发改委", "ndrc"));
        DEPARTMENTS.put("证监会", List.of("证监会", "csrc"));
        DEPARTMENTS.put("银保监会", List.of("银保监会", "cbirc"));
        DEPARTMENTS.put("商务部", List.of("商务部", "mofcom"));

        CSRC_TYPES.put("上市监管", List.of("上市", "发行", "ipo", "股票"));
        CSRC_TYPES.put("基金监管", List.of("基金", "资管", "理财"));
        CSRC_TYPES.put("期货监管", List.of("期货", "衍生品", "期权"));
        CSRC_TYPES.put("债券监管", List.of("债券", "公司债", "企业债"));
        CSRC_TYPES.put("执法监管", List.of("违法", "处罚", "罚款", "警告"));
        CSRC_TYPES.put("制度建设", List.of("规则", "办法", "规定", "指引"));
    }

    private static final List<String> HIGH_IMPACT = List.of("重大", "重要", "关键", "核心", "全面", "深化", "改革");
    private static final List<String> MEDIUM_IMPACT = List.of("推进", "加强", "完善", "优化", "提升");

    private static final List<String> MOF_POLICY_KEYWORDS = List.of(
            "通知", "公告", "办法", "规定", "意见", "方案", "政策", "措施",
            "财政", "税收", "预算", "资金", "补贴", "奖励", "支持", "管理",
            "实施", "暂行", "试行", "修订", "废止", "解释", "细则");
    private static final List<String> MOF_EXCLUDE_KEYWORDS = List.of(
            "招聘", "采购", "中标", "公示", "会议", "新闻", "动态",
            "领导", "机构", "简介", "职能", "联系", "地址");
    private static final List<String> MOF_URL_PATTERNS = List.of("zhengcefabu", "policy", "notice", "announcement");

    private PolicyAttributeClassifier() {
    }

    public static String classifyPolicyType(String title) {
        return firstMatch(POLICY_TYPES, title, "其他政策");
    }

    public static String classifyCsrcPolicyType(String title) {
        return firstMatch(CSRC_TYPES, title.toLowerCase(), "证券监管");
    }

    public static String extractDepartment(String title, String url) {
        String lowerUrl = url == null ? "" : url.toLowerCase();
        for (Map.Entry<String, List<String>> entry : DEPARTMENTS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (title.contains(keyword) || lowerUrl.contains(keyword)) {
                    return entry.getKey();
                }
            }
        }
        return "未知部门";
    }

    public static String determinePolicyLevel(String title) {
        if (containsAny(title, List.of("国务院", "中央", "全国"))) {
            return "国家级";
        }
        if (containsAny(title, List.of("省", "市", "地方"))) {
            return "地方级";
        }
        return "部委级";
    }

    public static String assessImpactLevel(String title) {
        if (containsAny(title, HIGH_IMPACT)) {
            return "高";
        }
        if (containsAny(title, MEDIUM_IMPACT)) {
            return "中";
        }
        return "低";
    }

    public static boolean isMofPolicyContent(String title, String url) {
        if (containsAny(title, MOF_EXCLUDE_KEYWORDS)) {
            return false;
        }
        if (containsAny(title, MOF_POLICY_KEYWORDS)) {
            return true;
        }
        return containsAny(url == null ? "" : url.toLowerCase(), MOF_URL_PATTERNS);
    }

    private static String firstMatch(Map<String, List<String>> table, String text, String fallback) {
        for (Map.Entry<String, List<String>> entry : table.entrySet()) {
            if (containsAny(text, entry.getValue())) {
                return entry.getKey();
            }
        }
        return fallback;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
