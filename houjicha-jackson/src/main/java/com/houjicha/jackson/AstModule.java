package com.houjicha.jackson;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.houjicha.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Jackson module that configures serialization/deserialization for the
 * houjicha AST records.
 *
 * This module handles:
 * - Polymorphic node types via the existing {@code type()} accessor
 * - Writing {@code type} and {@code range} ahead of the other properties
 */
public class AstModule extends SimpleModule {

    // Properties written first on every node, in this order
    private static final List<String> LEADING_PROPERTIES = List.of("type", "range");

    private static final List<Class<? extends Node>> NODE_CLASSES = List.of(
        Document.class, Namespace.class, Comment.class, Claim.class, Reference.class,
        Fact.class, Evaluation.class, Requirement.class, Norm.class, Issue.class,
        Reason.class, Conclusion.class, Effect.class, ReasonStatement.class,
        ConstantDefinition.class
    );

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.houjicha", "houjicha-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Register polymorphic type handling on the sealed interfaces
        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(DocumentChild.class, NodeMixin.class);
        context.setMixInAnnotations(NamespaceChild.class, NodeMixin.class);

        // And on each record, since mixins on interfaces are not reliably inherited
        for (Class<? extends Node> nodeClass : NODE_CLASSES) {
            context.setMixInAnnotations(nodeClass, NodeMixin.class);
        }

        context.addBeanSerializerModifier(new AstSerializerModifier());
    }

    // ==================== Mixins ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = Document.class, name = "Document"),
        @JsonSubTypes.Type(value = Namespace.class, name = "Namespace"),
        @JsonSubTypes.Type(value = Comment.class, name = "Comment"),
        @JsonSubTypes.Type(value = Claim.class, name = "Claim"),
        @JsonSubTypes.Type(value = Reference.class, name = "Reference"),
        @JsonSubTypes.Type(value = Fact.class, name = "Fact"),
        @JsonSubTypes.Type(value = Evaluation.class, name = "Evaluation"),
        @JsonSubTypes.Type(value = Requirement.class, name = "Requirement"),
        @JsonSubTypes.Type(value = Norm.class, name = "Norm"),
        @JsonSubTypes.Type(value = Issue.class, name = "Issue"),
        @JsonSubTypes.Type(value = Reason.class, name = "Reason"),
        @JsonSubTypes.Type(value = Conclusion.class, name = "Conclusion"),
        @JsonSubTypes.Type(value = Effect.class, name = "Effect"),
        @JsonSubTypes.Type(value = ReasonStatement.class, name = "ReasonStatement"),
        @JsonSubTypes.Type(value = ConstantDefinition.class, name = "ConstantDefinition")
    })
    private abstract static class NodeMixin {
        @JsonProperty("type")
        abstract String type();
    }

    // ==================== Serializer Modifier ====================

    private static class AstSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> orderProperties(SerializationConfig config,
                                                        BeanDescription beanDesc,
                                                        List<BeanPropertyWriter> beanProperties) {
            if (!Node.class.isAssignableFrom(beanDesc.getBeanClass())) {
                return beanProperties;
            }

            List<BeanPropertyWriter> ordered = new ArrayList<>(beanProperties.size());
            for (String name : LEADING_PROPERTIES) {
                for (BeanPropertyWriter prop : beanProperties) {
                    if (name.equals(prop.getName())) {
                        ordered.add(prop);
                    }
                }
            }
            for (BeanPropertyWriter prop : beanProperties) {
                if (!LEADING_PROPERTIES.contains(prop.getName())) {
                    ordered.add(prop);
                }
            }
            return ordered;
        }
    }
}
