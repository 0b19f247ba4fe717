package com.motherrealm.backend.roster.controller;

import com.motherrealm.backend.roster.api.AgentRegistrationRequest;
import com.motherrealm.backend.roster.api.AgentView;
import com.motherrealm.backend.roster.service.RosterService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/roster")
@Validated
public class RosterController {

  private final RosterService rosterService;

  public RosterController(RosterService rosterService) {
    this.rosterService = rosterService;
  }

  @GetMapping
  public List<AgentView> list() {
    return rosterService.listActive();
  }

  @PostMapping
  public AgentView register(@RequestBody @Valid AgentRegistrationRequest request) {
    return rosterService.register(request.name(), request.address(), request.type());
  }

  @DeleteMapping("/{name}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void remove(@PathVariable String name) {
    rosterService.remove(name);
  }
}
