package org.csu.astcalc.common.exception;

import lombok.Getter;

/**
 * @description: 求值阶段的自定义异常，表示数学上无定义的运算
 */
public class EvaluationException extends RuntimeException {

    @Getter
    private final ErrorKind kind = ErrorKind.EVAL_DOMAIN_ERROR;

    public EvaluationException(String message) {
        super(message);
    }
}
