package com.upstage.core.update;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 更新校验规则：命中即拒绝，并给出原因
 *
 * @param name    规则名，用于日志
 * @param rejects 拒绝条件
 * @param reason  拒绝原因
 */
public record UpdateRule(String name,
                         Predicate<UpdateCandidate> rejects,
                         Function<UpdateCandidate, String> reason) {

    public Optional<String> check(UpdateCandidate candidate) {
        return rejects.test(candidate) ? Optional.of(reason.apply(candidate)) : Optional.empty();
    }
}
