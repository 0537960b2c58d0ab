package info.isaksson.erland.sfsymbolsgen.mutate;

import info.isaksson.erland.sfsymbolsgen.ir.IrDeclaration;

/**
 * Symbol-keyed transform of a generated declaration.
 *
 * <p>Implementations must be side-effect free. A lookup miss returns the input unchanged.</p>
 */
public interface DeclarationMutator {

    IrDeclaration mutate(IrDeclaration declaration, String symbolName);
}
