package com.example.gateway.util;

import graphql.GraphQL;
import graphql.Scalars;
import graphql.execution.instrumentation.Instrumentation;
import graphql.schema.DataFetcher;
import graphql.schema.FieldCoordinates;
import graphql.schema.GraphQLArgument;
import graphql.schema.GraphQLCodeRegistry;
import graphql.schema.GraphQLList;
import graphql.schema.GraphQLNonNull;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static graphql.schema.GraphQLFieldDefinition.newFieldDefinition;

/**
 * Test builder for the project/members/tickets schema, resolved from plain maps.
 * Fetchers can be swapped to count or slow down resolution.
 */
public class ProjectSchemaTestBuilder {

    public static final String FULL_QUERY = "{\n"
            + "            project(id: 2) {\n"
            + "                id name members {\n"
            + "                    id name tickets {\n"
            + "                        id message\n"
            + "                    }\n"
            + "                }\n"
            + "            }\n"
            + "        }";

    public static final String ID_AND_NAME_QUERY = "{\n"
            + "            project(id: 2) {\n"
            + "                id name\n"
            + "            }\n"
            + "        }";

    private DataFetcher<?> projectFetcher = env -> {
        Integer id = env.getArgument("id");
        return Map.of("id", id, "name", "Project " + id);
    };

    private DataFetcher<?> projectsFetcher = env -> List.of(
            Map.of("id", 1, "name", "Project 1"),
            Map.of("id", 2, "name", "Project 2"));

    private DataFetcher<?> membersFetcher = env -> {
        Map<String, Object> project = env.getSource();
        return IntStream.rangeClosed(1, 2)
                .mapToObj(i -> Map.of("id", i, "name", "Project " + project.get("id") + ", Member: " + i))
                .toList();
    };

    private DataFetcher<?> ticketsFetcher = env -> {
        Map<String, Object> member = env.getSource();
        return IntStream.rangeClosed(1, 4)
                .mapToObj(i -> Map.of("id", i, "message", "Member " + member.get("id") + ", Ticket: " + i))
                .toList();
    };

    public static ProjectSchemaTestBuilder aProjectSchema() {
        return new ProjectSchemaTestBuilder();
    }

    public ProjectSchemaTestBuilder withProjectFetcher(DataFetcher<?> projectFetcher) {
        this.projectFetcher = projectFetcher;
        return this;
    }

    public ProjectSchemaTestBuilder withMembersFetcher(DataFetcher<?> membersFetcher) {
        this.membersFetcher = membersFetcher;
        return this;
    }

    public ProjectSchemaTestBuilder withTicketsFetcher(DataFetcher<?> ticketsFetcher) {
        this.ticketsFetcher = ticketsFetcher;
        return this;
    }

    public GraphQLSchema build() {
        GraphQLObjectType ticketType = GraphQLObjectType.newObject()
                .name("TicketType")
                .field(newFieldDefinition().name("id").type(Scalars.GraphQLInt))
                .field(newFieldDefinition().name("message").type(Scalars.GraphQLString))
                .build();

        GraphQLObjectType memberType = GraphQLObjectType.newObject()
                .name("MemberType")
                .field(newFieldDefinition().name("id").type(Scalars.GraphQLInt))
                .field(newFieldDefinition().name("name").type(Scalars.GraphQLString))
                .field(newFieldDefinition().name("tickets").type(GraphQLList.list(ticketType)))
                .build();

        GraphQLObjectType projectType = GraphQLObjectType.newObject()
                .name("ProjectType")
                .field(newFieldDefinition().name("id").type(GraphQLNonNull.nonNull(Scalars.GraphQLInt)))
                .field(newFieldDefinition().name("name").type(Scalars.GraphQLString))
                .field(newFieldDefinition().name("members").type(GraphQLList.list(memberType)))
                .build();

        GraphQLObjectType queryType = GraphQLObjectType.newObject()
                .name("Query")
                .field(newFieldDefinition()
                        .name("project")
                        .type(projectType)
                        .argument(GraphQLArgument.newArgument().name("id").type(Scalars.GraphQLInt)))
                .field(newFieldDefinition().name("projects").type(GraphQLList.list(projectType)))
                .build();

        GraphQLCodeRegistry codeRegistry = GraphQLCodeRegistry.newCodeRegistry()
                .dataFetcher(FieldCoordinates.coordinates("Query", "project"), projectFetcher)
                .dataFetcher(FieldCoordinates.coordinates("Query", "projects"), projectsFetcher)
                .dataFetcher(FieldCoordinates.coordinates("ProjectType", "members"), membersFetcher)
                .dataFetcher(FieldCoordinates.coordinates("MemberType", "tickets"), ticketsFetcher)
                .build();

        return GraphQLSchema.newSchema()
                .query(queryType)
                .codeRegistry(codeRegistry)
                .build();
    }

    public GraphQL buildGraphQL(Instrumentation instrumentation) {
        return GraphQL.newGraphQL(build())
                .instrumentation(instrumentation)
                .build();
    }
}
