package com.querydesk.portal.security;

import com.querydesk.portal.repository.AdminRepository;
import com.querydesk.portal.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

/**
 * Resolves a login name to an admin account first, then to a student account.
 */
@Service
@RequiredArgsConstructor
public class PortalUserDetailsService implements UserDetailsService {

    private final AdminRepository adminRepository;
    private final StudentRepository studentRepository;

    @Override
    public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
        var admin = adminRepository.findByUsername(username);
        if (admin.isPresent()) {
            return new User(
                    admin.get().getUsername(),
                    admin.get().getPasswordHash(),
                    admin.get().isActive(), true, true, true,
                    AuthorityUtils.createAuthorityList("ROLE_ADMIN"));
        }

        return studentRepository.findByStudentId(username)
                .map(student -> new User(
                        student.getStudentId(),
                        student.getPasswordHash(),
                        true, true, true, true,
                        AuthorityUtils.createAuthorityList("ROLE_STUDENT")))
                .orElseThrow(() -> new UsernameNotFoundException("User not found: " + username));
    }
}
