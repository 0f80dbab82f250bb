/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.instaclustr.ldap.strategy.jndi;

import static java.lang.String.format;

import javax.naming.Context;
import javax.naming.NameNotFoundException;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.SizeLimitExceededException;
import javax.naming.TimeLimitExceededException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.InitialDirContext;
import javax.naming.directory.SearchControls;
import javax.naming.directory.SearchResult;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Hashtable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.instaclustr.ldap.strategy.client.BindResultHandler;
import com.instaclustr.ldap.strategy.client.DirectoryClient;
import com.instaclustr.ldap.strategy.client.DirectoryConnection;
import com.instaclustr.ldap.strategy.client.DirectoryEntry;
import com.instaclustr.ldap.strategy.client.DirectoryException;
import com.instaclustr.ldap.strategy.client.SearchResultHandler;
import com.instaclustr.ldap.strategy.conf.SearchSpec;
import com.instaclustr.ldap.strategy.conf.ServerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DirectoryClient} on top of JNDI. JNDI calls block, so binds and result enumeration run on an executor and
 * report back through the handlers.
 */
public class JndiDirectoryClient implements DirectoryClient
{

    private static final Logger logger = LoggerFactory.getLogger(JndiDirectoryClient.class);

    static final int SUCCESS = 0;
    static final int TIME_LIMIT_EXCEEDED = 3;
    static final int SIZE_LIMIT_EXCEEDED = 4;
    static final int NO_SUCH_OBJECT = 32;

    private static final Executor DEFAULT_EXECUTOR = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                                                                                       .setNameFormat("ldap-strategy-%d")
                                                                                       .setDaemon(true)
                                                                                       .build());

    private final Executor executor;

    public JndiDirectoryClient()
    {
        this(DEFAULT_EXECUTOR);
    }

    public JndiDirectoryClient(final Executor executor)
    {
        this.executor = executor;
    }

    @Override
    public DirectoryConnection connect(final ServerSpec server) throws DirectoryException
    {
        if (server == null || server.getUrl() == null)
        {
            throw new DirectoryException("No LDAP server URL to connect to.");
        }

        return new JndiDirectoryConnection(server, executor);
    }

    static final class JndiDirectoryConnection implements DirectoryConnection
    {

        private final ServerSpec server;
        private final Executor executor;

        private volatile InitialDirContext context;
        private volatile boolean closed;

        JndiDirectoryConnection(final ServerSpec server, final Executor executor)
        {
            this.server = server;
            this.executor = executor;
        }

        @Override
        public void bind(final String dn, final String password, final BindResultHandler handler)
        {
            if (password == null || password.isEmpty())
            {
                // JNDI turns a simple bind without password into an anonymous one
                handler.handleBindFailure(new DirectoryException(format("Refusing to bind %s without a password", dn)));
                return;
            }

            final Runnable bind = () ->
            {
                try
                {
                    context = new InitialDirContext(getUserEnv(dn, password));

                    if (closed)
                    {
                        closeContext();
                    }

                    logger.debug("Bind as {} was ok", dn);
                }
                catch (final NamingException ex)
                {
                    handler.handleBindFailure(new DirectoryException(format("Bind as %s failed: %s, explanation: %s",
                                                                            dn,
                                                                            ex.getMessage(),
                                                                            ex.getExplanation() == null ? "unknown" : ex.getExplanation()),
                                                                     ex));
                    return;
                }

                handler.handleBindSuccess();
            };

            try
            {
                executor.execute(bind);
            }
            catch (final RejectedExecutionException ex)
            {
                handler.handleBindFailure(new DirectoryException("Bind could not be scheduled", ex));
            }
        }

        @Override
        public void search(final String baseDn, final SearchSpec spec, final SearchResultHandler handler) throws DirectoryException
        {
            final InitialDirContext ctx = context;

            if (ctx == null || closed)
            {
                throw new DirectoryException("Connection is not bound");
            }

            final SearchControls searchControls = new SearchControls();
            searchControls.setSearchScope(spec.getScope().getJndiScope());
            searchControls.setCountLimit(spec.getSizeLimit());
            searchControls.setTimeLimit(spec.getTimeLimit() * 1000);

            if (!spec.getAttributes().isEmpty())
            {
                searchControls.setReturningAttributes(spec.getAttributes().toArray(new String[0]));
            }

            logger.debug("Searching under {} with filter {}", baseDn, spec.getFilter());

            final NamingEnumeration<SearchResult> answer;

            try
            {
                answer = ctx.search(baseDn, spec.getFilter(), searchControls);
            }
            catch (final NameNotFoundException ex)
            {
                logger.debug("Search base {} does not exist: {}", baseDn, ex.getMessage());
                handler.handleDone(NO_SUCH_OBJECT);
                return;
            }
            catch (final NamingException ex)
            {
                throw new DirectoryException(format("Search under %s with filter %s could not be issued: %s",
                                                    baseDn,
                                                    spec.getFilter(),
                                                    ex.getMessage()),
                                             ex);
            }

            try
            {
                executor.execute(() -> deliver(answer, handler));
            }
            catch (final RejectedExecutionException ex)
            {
                closeQuietly(answer);
                throw new DirectoryException("Search result delivery could not be scheduled", ex);
            }
        }

        private void deliver(final NamingEnumeration<SearchResult> answer, final SearchResultHandler handler)
        {
            int status = SUCCESS;

            try
            {
                while (answer.hasMore())
                {
                    final SearchResult result = answer.next();
                    handler.handleEntry(toEntry(result));
                }
            }
            catch (final SizeLimitExceededException ex)
            {
                status = SIZE_LIMIT_EXCEEDED;
            }
            catch (final TimeLimitExceededException ex)
            {
                status = TIME_LIMIT_EXCEEDED;
            }
            catch (final NameNotFoundException ex)
            {
                status = NO_SUCH_OBJECT;
            }
            catch (final NamingException ex)
            {
                logger.error("Error while searching! " + ex.toString(true) + " explanation: " + ex.getExplanation(), ex);
                closeQuietly(answer);
                handler.handleError(ex);
                return;
            }

            closeQuietly(answer);
            handler.handleDone(status);
        }

        @Override
        public void close()
        {
            closed = true;
            closeContext();
        }

        private void closeContext()
        {
            final InitialDirContext ctx = context;

            if (ctx != null)
            {
                context = null;

                try
                {
                    ctx.close();
                }
                catch (final NamingException ex)
                {
                    logger.warn("Failing to close connection to LDAP server.", ex);
                }
            }
        }

        private static void closeQuietly(final NamingEnumeration<SearchResult> answer)
        {
            try
            {
                answer.close();
            }
            catch (final NamingException closingException)
            {
                logger.warn("Failing to close search results from LDAP server.", closingException);
            }
        }

        private static DirectoryEntry toEntry(final SearchResult result) throws NamingException
        {
            final Map<String, List<String>> attributes = new LinkedHashMap<>();
            final Attributes resultAttributes = result.getAttributes();

            if (resultAttributes != null)
            {
                final NamingEnumeration<? extends Attribute> all = resultAttributes.getAll();

                try
                {
                    while (all.hasMore())
                    {
                        final Attribute attribute = all.next();
                        final List<String> values = new ArrayList<>();

                        for (int i = 0; i < attribute.size(); i++)
                        {
                            final Object value = attribute.get(i);

                            if (value instanceof byte[])
                            {
                                values.add(Base64.getEncoder().encodeToString((byte[]) value));
                            }
                            else
                            {
                                values.add(String.valueOf(value));
                            }
                        }

                        attributes.put(attribute.getID(), values);
                    }
                }
                finally
                {
                    all.close();
                }
            }

            return new DirectoryEntry(result.getNameInNamespace(), attributes);
        }

        private Hashtable<String, String> getUserEnv(final String username, final String password)
        {
            final Hashtable<String, String> env = new Hashtable<>(11);

            env.putAll(server.getEnvironment());

            env.put(Context.INITIAL_CONTEXT_FACTORY, server.getContextFactory());
            env.put(Context.PROVIDER_URL, server.getUrl());
            env.put(Context.SECURITY_AUTHENTICATION, "simple");
            env.put("com.sun.jndi.ldap.connect.timeout", String.valueOf(server.getConnectTimeoutMillis()));
            env.put("com.sun.jndi.ldap.read.timeout", String.valueOf(server.getReadTimeoutMillis()));
            env.put("com.sun.jndi.ldap.connect.pool", "false");

            env.put(Context.SECURITY_PRINCIPAL, username);
            env.put(Context.SECURITY_CREDENTIALS, password);

            return env;
        }
    }
}
