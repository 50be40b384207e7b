package com.themis.refinery.core.engine;

import com.themis.refinery.api.model.Rule;
import com.themis.refinery.api.model.RuleType;

import java.util.List;

/**
 * Rules a brand-new store starts from.
 */
public final class DefaultRules {

    private DefaultRules() {
    }

    public static List<Rule> bootstrap() {
        return List.of(
                Rule.of("page_number_line", RuleType.NOISE_REMOVAL,
                        "(?m)^[ \\t]*(?:페이지|page)[ \\t]*\\d+[ \\t]*(?:\\n|$)", "",
                        100, "페이지 번호만 있는 줄 제거"),
                Rule.of("page_number_inline", RuleType.NOISE_REMOVAL,
                        "(?:페이지|page)[ \\t]*\\d+", "",
                        95, "본문 중간의 페이지 번호 제거"),
                Rule.of("separator_line", RuleType.NOISE_REMOVAL,
                        "(?m)^[ \\t]*[-=_]{3,}[ \\t]*(?:\\n|$)", "",
                        90, "구분선 제거"),
                Rule.of("blank_lines", RuleType.POST_NORMALIZE,
                        "\\n{3,}", "\n\n",
                        20, "연속된 빈 줄 정리"),
                Rule.of("repeated_spaces", RuleType.POST_NORMALIZE,
                        "[ \\t]{2,}", " ",
                        10, "연속 공백 정리"));
    }
}
