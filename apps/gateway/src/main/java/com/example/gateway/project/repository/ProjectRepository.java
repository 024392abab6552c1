package com.example.gateway.project.repository;

import com.example.gateway.project.model.Member;
import com.example.gateway.project.model.Project;
import com.example.gateway.project.model.Ticket;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Generated sample data: every project has two members, every member four tickets.
 */
@Repository
public class ProjectRepository {

    private static final int MEMBERS_PER_PROJECT = 2;
    private static final int TICKETS_PER_MEMBER = 4;
    private static final List<Integer> PROJECT_IDS = List.of(1, 2);

    public Optional<Project> findById(int id) {
        return Optional.of(new Project(id, "Project " + id));
    }

    public List<Project> findAll() {
        return PROJECT_IDS.stream()
                .map(id -> new Project(id, "Project " + id))
                .toList();
    }

    public List<Member> findMembers(Project project) {
        return IntStream.rangeClosed(1, MEMBERS_PER_PROJECT)
                .mapToObj(i -> new Member(i, String.format("Project %d, Member: %d", project.id(), i)))
                .toList();
    }

    public List<Ticket> findTickets(Member member) {
        return IntStream.rangeClosed(1, TICKETS_PER_MEMBER)
                .mapToObj(i -> new Ticket(i, String.format("Member %d, Ticket: %d", member.id(), i)))
                .toList();
    }
}
