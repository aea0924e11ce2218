package com.carhire.rental.service;

import com.carhire.rental.entity.User;
import com.carhire.rental.exception.AccessDeniedException;
import com.carhire.rental.exception.ResourceNotFoundException;
import com.carhire.rental.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Resolves the caller set by {@code AuthInterceptor} and checks roles.
 */
@Service
@RequiredArgsConstructor
public class UserAccessService {

    private final UserRepository userRepository;

    public User requireUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    }

    public User requireStaff(Long userId) {
        User user = requireUser(userId);
        if (!user.isStaff()) {
            throw new AccessDeniedException("Staff access required");
        }
        return user;
    }

    /** Returns the caller if they own the record or are staff. */
    public User requireOwnerOrStaff(Long userId, User owner) {
        User user = requireUser(userId);
        if (!user.isStaff() && !user.getId().equals(owner.getId())) {
            throw new AccessDeniedException("Not allowed to access this record");
        }
        return user;
    }
}
