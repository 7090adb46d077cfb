package com.webchat.chatbackend.user;

import com.webchat.chatbackend.user.dto.UserSummaryDto;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

@Service
@RequiredArgsConstructor
public class UserService {

    static final int SEARCH_LIMIT = 20;

    private final UserRepository userRepository;

    /** Users matching username or email, never the caller. A blank query returns suggestions. */
    @Transactional(readOnly = true)
    public List<UserSummaryDto> search(Long callerId, String query) {
        List<User> found = StringUtils.hasText(query)
                ? userRepository.search(query.trim(), callerId, PageRequest.of(0, SEARCH_LIMIT))
                : userRepository.findByIdNot(callerId, PageRequest.of(0, SEARCH_LIMIT, Sort.by("username")));
        return found.stream().map(UserSummaryDto::from).toList();
    }
}
