package com.example.gateway.project.controller;

import com.example.gateway.project.model.Member;
import com.example.gateway.project.model.Project;
import com.example.gateway.project.model.Ticket;
import com.example.gateway.project.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.graphql.data.method.annotation.SchemaMapping;
import org.springframework.stereotype.Controller;

import java.util.List;

@Controller
@RequiredArgsConstructor
public class ProjectController {

    private final ProjectRepository projectRepository;

    @QueryMapping
    public Project project(@Argument Integer id) {
        return id == null ? null : projectRepository.findById(id).orElse(null);
    }

    @QueryMapping
    public List<Project> projects() {
        return projectRepository.findAll();
    }

    @SchemaMapping(typeName = "ProjectType")
    public List<Member> members(Project project) {
        return projectRepository.findMembers(project);
    }

    @SchemaMapping(typeName = "MemberType")
    public List<Ticket> tickets(Member member) {
        return projectRepository.findTickets(member);
    }
}
