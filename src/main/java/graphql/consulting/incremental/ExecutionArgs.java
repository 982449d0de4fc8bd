package graphql.consulting.incremental;

import graphql.Assert;
import graphql.GraphQLContext;
import graphql.PublicApi;
import graphql.language.Document;
import graphql.parser.Parser;

import java.util.Collections;
import java.util.Map;

/**
 * One request to execute: the document, which operation to run and the values to run it with.
 */
@PublicApi
public class ExecutionArgs {

    private final Document document;
    private final String operationName;
    private final Map<String, Object> variables;
    private final Object root;
    private final Object context;
    private final GraphQLContext graphQLContext;

    private ExecutionArgs(Builder builder) {
        this.document = builder.document;
        this.operationName = builder.operationName;
        this.variables = builder.variables;
        this.root = builder.root;
        this.context = builder.context;
        this.graphQLContext = builder.graphQLContext != null ? builder.graphQLContext : GraphQLContext.newContext().build();
    }

    public Document getDocument() {
        return document;
    }

    public String getOperationName() {
        return operationName;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public Object getRoot() {
        return root;
    }

    public Object getContext() {
        return context;
    }

    public GraphQLContext getGraphQLContext() {
        return graphQLContext;
    }

    public static Builder newExecutionArgs() {
        return new Builder();
    }

    public static Builder newExecutionArgs(String query) {
        return new Builder().query(query);
    }

    public static class Builder {
        private Document document;
        private String operationName;
        private Map<String, Object> variables = Collections.emptyMap();
        private Object root;
        private Object context;
        private GraphQLContext graphQLContext;

        private Builder() {
        }

        public Builder document(Document document) {
            this.document = document;
            return this;
        }

        /**
         * Parses the query with graphql-java's parser.
         */
        public Builder query(String query) {
            this.document = Parser.parse(query);
            return this;
        }

        public Builder operationName(String operationName) {
            this.operationName = operationName;
            return this;
        }

        public Builder variables(Map<String, Object> variables) {
            this.variables = variables;
            return this;
        }

        public Builder root(Object root) {
            this.root = root;
            return this;
        }

        public Builder context(Object context) {
            this.context = context;
            return this;
        }

        public Builder graphQLContext(GraphQLContext graphQLContext) {
            this.graphQLContext = graphQLContext;
            return this;
        }

        public ExecutionArgs build() {
            Assert.assertNotNull(document, () -> "You must provide a document");
            return new ExecutionArgs(this);
        }
    }
}
