package com.example.contractlens.parser.syntax;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Type names as written in declarations. {@link #render()} produces the composed
 * spelling stored in the contract model, e.g. {@code mapping(address => uint256[])}.
 */
public sealed interface TypeName {

    String render();

    record ElementaryType(String name, boolean payable) implements TypeName {
        @Override
        public String render() {
            return payable ? name + " payable" : name;
        }
    }

    record UserDefinedType(String namePath) implements TypeName {
        @Override
        public String render() {
            return namePath;
        }
    }

    /** {@code length} is null for dynamic arrays. */
    record ArrayType(TypeName baseType, Expression length) implements TypeName {
        @Override
        public String render() {
            return baseType.render() + "[" + renderLength() + "]";
        }

        private String renderLength() {
            if (length instanceof Expression.Literal literal) {
                return literal.value();
            }
            if (length instanceof Expression.Identifier identifier) {
                return identifier.name();
            }
            return "";
        }
    }

    record MappingType(TypeName keyType, String keyName, TypeName valueType, String valueName)
            implements TypeName {
        @Override
        public String render() {
            return "mapping(" + keyType.render() + " => " + valueType.render() + ")";
        }
    }

    record FunctionType(
            List<VariableDeclaration> parameters,
            List<VariableDeclaration> returns,
            String visibility,
            String mutability)
            implements TypeName {
        public FunctionType {
            parameters = List.copyOf(parameters);
            returns = List.copyOf(returns);
        }

        @Override
        public String render() {
            StringBuilder rendered = new StringBuilder("function(")
                    .append(parameters.stream()
                            .map(p -> p.typeName().render())
                            .collect(Collectors.joining(",")))
                    .append(")");
            if (visibility != null) {
                rendered.append(' ').append(visibility);
            }
            if (mutability != null) {
                rendered.append(' ').append(mutability);
            }
            if (!returns.isEmpty()) {
                rendered.append(" returns (")
                        .append(returns.stream()
                                .map(p -> p.typeName().render())
                                .collect(Collectors.joining(",")))
                        .append(")");
            }
            return rendered.toString();
        }
    }
}
