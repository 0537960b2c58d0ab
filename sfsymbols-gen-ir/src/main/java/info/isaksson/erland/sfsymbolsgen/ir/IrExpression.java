package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Base type of all expression nodes.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "node")
public abstract class IrExpression {

    IrExpression() {}

    public abstract IrExpressionKind kind();
}
