package com.hinata.backend.modules.organization.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import com.hinata.backend.global.error.ConflictException;
import com.hinata.backend.global.error.DatabaseException;
import com.hinata.backend.global.error.NotFoundException;
import com.hinata.backend.global.error.ValidationException;
import com.hinata.backend.modules.auth.domain.AppUser;
import com.hinata.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.hinata.backend.modules.organization.domain.Organization;
import com.hinata.backend.modules.organization.domain.OrganizationUser;
import com.hinata.backend.modules.organization.domain.Team;
import com.hinata.backend.modules.organization.domain.TeamMember;
import com.hinata.backend.modules.organization.infrastructure.persistence.OrganizationRepository;
import com.hinata.backend.modules.organization.infrastructure.persistence.OrganizationUserRepository;
import com.hinata.backend.modules.organization.infrastructure.persistence.TeamMemberRepository;
import com.hinata.backend.modules.organization.infrastructure.persistence.TeamRepository;
import com.hinata.backend.modules.rbac.domain.Role;
import com.hinata.backend.modules.rbac.domain.Scope;
import com.hinata.backend.modules.rbac.infrastructure.persistence.RoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 조직/팀 멤버십 관리. 멤버십마다 종류에 맞는 스코프의 역할을 하나씩 가진다.
 */
@Service
@Transactional
public class MembershipService {

    private static final Logger log = LoggerFactory.getLogger(MembershipService.class);

    private final OrganizationRepository organizationRepository;
    private final TeamRepository teamRepository;
    private final OrganizationUserRepository organizationUserRepository;
    private final TeamMemberRepository teamMemberRepository;
    private final AppUserRepository appUserRepository;
    private final RoleRepository roleRepository;
    private final Clock clock;

    public MembershipService(
            OrganizationRepository organizationRepository,
            TeamRepository teamRepository,
            OrganizationUserRepository organizationUserRepository,
            TeamMemberRepository teamMemberRepository,
            AppUserRepository appUserRepository,
            RoleRepository roleRepository,
            Clock clock
    ) {
        this.organizationRepository = organizationRepository;
        this.teamRepository = teamRepository;
        this.organizationUserRepository = organizationUserRepository;
        this.teamMemberRepository = teamMemberRepository;
        this.appUserRepository = appUserRepository;
        this.roleRepository = roleRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public OrganizationUser getOrganizationMembership(Long userId, Long organizationId) {
        return organizationUserRepository.findMembership(userId, organizationId)
                .orElseThrow(() -> new NotFoundException("MEMBERSHIP_NOT_FOUND",
                        "User " + userId + " is not a member of organization " + organizationId));
    }

    @Transactional(readOnly = true)
    public TeamMember getTeamMembership(Long userId, Long teamId) {
        return teamMemberRepository.findMembership(userId, teamId)
                .orElseThrow(() -> new NotFoundException("MEMBERSHIP_NOT_FOUND",
                        "User " + userId + " is not a member of team " + teamId));
    }

    @Transactional(readOnly = true)
    public Role getRoleOfUserInOrganization(Long userId, Long organizationId) {
        return getOrganizationMembership(userId, organizationId).getRole();
    }

    @Transactional(readOnly = true)
    public Role getRoleOfUserInTeam(Long userId, Long teamId) {
        return getTeamMembership(userId, teamId).getRole();
    }

    @Transactional(readOnly = true)
    public Optional<OrganizationUser> findOrganizationMembership(Long userId, Long organizationId) {
        return organizationUserRepository.findMembership(userId, organizationId);
    }

    @Transactional(readOnly = true)
    public Optional<TeamMember> findTeamMembership(Long userId, Long teamId) {
        return teamMemberRepository.findMembership(userId, teamId);
    }

    @Transactional(readOnly = true)
    public List<OrganizationUser> listOrganizationsOfUser(Long userId) {
        return organizationUserRepository.findAllByUserId(userId);
    }

    @Transactional(readOnly = true)
    public List<TeamMember> listTeamsOfUser(Long userId) {
        return teamMemberRepository.findAllByUserId(userId);
    }

    @Transactional(readOnly = true)
    public Team getTeam(Long teamId) {
        return teamRepository.findWithOrganizationById(teamId)
                .orElseThrow(() -> new NotFoundException("TEAM_NOT_FOUND", "Team " + teamId + " not found"));
    }

    /**
     * Loads a team addressed through an organization path and rejects teams owned by another organization.
     */
    @Transactional(readOnly = true)
    public Team getTeamInOrganization(Long organizationId, Long teamId) {
        Team team = getTeam(teamId);
        if (!team.getOrganization().getId().equals(organizationId)) {
            throw new ValidationException("TEAM_NOT_IN_ORGANIZATION",
                    "Team " + teamId + " does not belong to organization " + organizationId);
        }
        return team;
    }

    @Transactional(readOnly = true)
    public List<Team> listTeams(Long organizationId) {
        return teamRepository.findAllByOrganizationId(organizationId);
    }

    @Transactional(readOnly = true)
    public List<TeamMember> listTeamMembers(Long teamId) {
        getTeam(teamId);
        return teamMemberRepository.findAllByTeamId(teamId);
    }

    /**
     * 조직 생성 API는 없다. 통합 테스트 픽스처(TestUserFactory)가 조직을 만들 때만 쓴다.
     */
    public Organization createOrganization(String name) {
        Organization organization = new Organization();
        organization.setName(name);
        organization.setCreationDate(OffsetDateTime.now(clock));
        return persist(() -> organizationRepository.save(organization), "ORGANIZATION_CREATE_FAILED");
    }

    public Team createTeam(Long organizationId, String name, String description) {
        Organization organization = organizationRepository.findById(organizationId)
                .orElseThrow(() -> new NotFoundException("ORGANIZATION_NOT_FOUND", "Organization " + organizationId + " not found"));
        if (teamRepository.existsByOrganizationIdAndNameIgnoreCase(organizationId, name)) {
            throw new ConflictException("TEAM_NAME_EXISTS", "Team '" + name + "' already exists in organization " + organizationId);
        }
        Team team = new Team();
        team.setOrganization(organization);
        team.setName(name);
        team.setDescription(description);
        Team saved = persist(() -> teamRepository.saveAndFlush(team), "TEAM_CREATE_FAILED");
        log.info("Team created: organizationId={}, teamId={}", organizationId, saved.getId());
        return saved;
    }

    /**
     * Adds the user to the organization, or changes the role of an existing membership.
     */
    public OrganizationUser assignOrganizationRole(Long organizationId, Long userId, Long roleId) {
        Organization organization = organizationRepository.findById(organizationId)
                .orElseThrow(() -> new NotFoundException("ORGANIZATION_NOT_FOUND", "Organization " + organizationId + " not found"));
        AppUser user = loadUser(userId);
        Role role = loadRoleInScope(roleId, Scope.ORGANIZATION);

        OrganizationUser membership = organizationUserRepository.findMembership(userId, organizationId)
                .map(existing -> {
                    existing.setRole(role);
                    return existing;
                })
                .orElseGet(() -> new OrganizationUser(organization, user, role));
        OrganizationUser saved = persist(() -> organizationUserRepository.saveAndFlush(membership), "MEMBERSHIP_SAVE_FAILED");
        log.info("Organization role assigned: organizationId={}, userId={}, role={}", organizationId, userId, role.getName());
        return saved;
    }

    /**
     * Adds the user to the team, or changes the role of an existing membership.
     * The user must already belong to the team's organization.
     */
    public TeamMember assignTeamRole(Long teamId, Long userId, Long roleId) {
        Team team = getTeam(teamId);
        AppUser user = loadUser(userId);
        Role role = loadRoleInScope(roleId, Scope.TEAM);
        if (!organizationUserRepository.existsByUserIdAndOrganizationId(userId, team.getOrganization().getId())) {
            throw new ValidationException("USER_NOT_IN_ORGANIZATION",
                    "User " + userId + " must join organization " + team.getOrganization().getId() + " before joining its teams");
        }

        TeamMember membership = teamMemberRepository.findMembership(userId, teamId)
                .map(existing -> {
                    existing.setRole(role);
                    return existing;
                })
                .orElseGet(() -> new TeamMember(team, user, role));
        TeamMember saved = persist(() -> teamMemberRepository.saveAndFlush(membership), "MEMBERSHIP_SAVE_FAILED");
        log.info("Team role assigned: teamId={}, userId={}, role={}", teamId, userId, role.getName());
        return saved;
    }

    public void removeTeamMember(Long teamId, Long userId) {
        TeamMember membership = teamMemberRepository.findMembership(userId, teamId)
                .orElseThrow(() -> new NotFoundException("MEMBERSHIP_NOT_FOUND",
                        "User " + userId + " is not a member of team " + teamId));
        teamMemberRepository.delete(membership);
        log.info("Team member removed: teamId={}, userId={}", teamId, userId);
    }

    private AppUser loadUser(Long userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("USER_NOT_FOUND", "User " + userId + " not found"));
    }

    private Role loadRoleInScope(Long roleId, Scope expected) {
        Role role = roleRepository.findById(roleId)
                .orElseThrow(() -> new NotFoundException("ROLE_NOT_FOUND", "Role " + roleId + " not found"));
        if (role.getScope() != expected) {
            throw new ValidationException("ROLE_SCOPE_MISMATCH",
                    "Role '" + role.getName() + "' has scope " + role.getScope().key() + ", expected " + expected.key());
        }
        return role;
    }

    private <T> T persist(Supplier<T> write, String failureCode) {
        try {
            return write.get();
        } catch (DataIntegrityViolationException ex) {
            throw new ConflictException("MEMBERSHIP_CONFLICT", "A concurrent change already created this record");
        } catch (DataAccessException ex) {
            throw new DatabaseException(failureCode, "Failed to persist membership data", ex);
        }
    }
}
